package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Scores how closely the first hours of an app's life match a dropper or loader: quiet install,
 * then SMS or network within minutes, accessibility or overlay within hours, escalation within days.
 */
@Slf4j
@Service
public class InstallTimelineAnalyzer {

    static final Duration IMMEDIATE_WINDOW = Duration.ofMinutes(10);
    static final Duration SHORT_WINDOW = Duration.ofHours(6);
    static final Duration MEDIUM_WINDOW = Duration.ofHours(48);
    static final Duration FRESH_INSTALL_THRESHOLD = Duration.ofHours(48);

    static final double WEIGHT_FRESH_INSTALL_BASE = 0.10;
    static final double WEIGHT_IMMEDIATE_NETWORK = 0.15;
    static final double WEIGHT_IMMEDIATE_SMS = 0.20;
    static final double WEIGHT_SHORT_ACCESSIBILITY = 0.25;
    static final double WEIGHT_SHORT_OVERLAY = 0.20;
    static final double WEIGHT_MEDIUM_ESCALATION = 0.15;
    static final double WEIGHT_BOOT_PERSISTENCE = 0.10;
    static final double WEIGHT_DYNAMIC_CODE_LOADING = 0.15;
    static final double WEIGHT_INSTALL_PACKAGES = 0.15;
    static final double WEIGHT_LOW_TRUST = 0.15;
    static final double WEIGHT_SIDELOAD = 0.10;

    public TimelineResult analyze(AppFeatureVector app, List<SecurityEvent> recentEvents, Instant now) {
        Instant installTime = app.change().lastUpdateAt() != null ? app.change().lastUpdateAt() : app.timestamp();
        long installAgeMs = installTime != null ? Duration.between(installTime, now).toMillis() : 0L;
        boolean fresh = installAgeMs > 0 && installAgeMs <= FRESH_INSTALL_THRESHOLD.toMillis();

        if (!fresh) {
            InstallPhase phase = installAgeMs > 0 ? InstallPhase.ESTABLISHED : InstallPhase.NOT_APPLICABLE;
            return new TimelineResult(app.packageName(), 0.0, phase, List.of(), false, installAgeMs);
        }

        InstallPhase phase;
        if (installAgeMs <= IMMEDIATE_WINDOW.toMillis()) {
            phase = InstallPhase.IMMEDIATE;
        } else if (installAgeMs <= SHORT_WINDOW.toMillis()) {
            phase = InstallPhase.SHORT_TERM;
        } else {
            phase = InstallPhase.MEDIUM_TERM;
        }

        List<TimelineSignal> signals = new ArrayList<>();
        signals.add(new TimelineSignal(TimelineSignalType.FRESH_INSTALL,
                "App installed " + formatAge(installAgeMs) + " ago", WEIGHT_FRESH_INSTALL_BASE, installAgeMs));

        List<SecurityEvent> appEvents = recentEvents == null ? List.of() : recentEvents.stream()
                .filter(e -> Objects.equals(e.packageName(), app.packageName()))
                .toList();
        Set<SignalType> signalTypes = EnumSet.noneOf(SignalType.class);
        appEvents.forEach(e -> e.signals().forEach(s -> signalTypes.add(s.type())));
        Set<CapabilityCluster> clusters = app.capability().activeHighRiskClusters();

        if (installAgeMs <= IMMEDIATE_WINDOW.toMillis() || hasEventInWindow(appEvents, installTime, IMMEDIATE_WINDOW)) {
            if (signalTypes.contains(SignalType.NETWORK_BURST_ANOMALY)
                    || signalTypes.contains(SignalType.NETWORK_AFTER_INSTALL)) {
                signals.add(new TimelineSignal(TimelineSignalType.NETWORK_BURST_AFTER_INSTALL,
                        "Network traffic right after install", WEIGHT_IMMEDIATE_NETWORK, installAgeMs));
            }
            if (clusters.contains(CapabilityCluster.SMS)) {
                signals.add(new TimelineSignal(TimelineSignalType.SMS_ACCESS_AFTER_INSTALL,
                        "SMS access requested right after install", WEIGHT_IMMEDIATE_SMS, installAgeMs));
            }
        }

        if (installAgeMs <= SHORT_WINDOW.toMillis() || hasEventInWindow(appEvents, installTime, SHORT_WINDOW)) {
            boolean accessibility = clusters.contains(CapabilityCluster.ACCESSIBILITY)
                    || (app.specialAccess() != null && app.specialAccess().accessibilityEnabled())
                    || signalTypes.contains(SignalType.SPECIAL_ACCESS_ENABLED)
                    || signalTypes.contains(SignalType.UNKNOWN_ACCESSIBILITY_SERVICE);
            if (accessibility) {
                signals.add(new TimelineSignal(TimelineSignalType.ACCESSIBILITY_AFTER_INSTALL,
                        "Accessibility enabled within " + formatAge(SHORT_WINDOW.toMillis()) + " of install",
                        WEIGHT_SHORT_ACCESSIBILITY, installAgeMs));
            }
            if (clusters.contains(CapabilityCluster.OVERLAY)) {
                signals.add(new TimelineSignal(TimelineSignalType.OVERLAY_AFTER_INSTALL,
                        "Overlay permission within " + formatAge(SHORT_WINDOW.toMillis()) + " of install",
                        WEIGHT_SHORT_OVERLAY, installAgeMs));
            }
        }

        if (installAgeMs <= MEDIUM_WINDOW.toMillis()
                && (signalTypes.contains(SignalType.HIGH_RISK_PERM_ADDED)
                || signalTypes.contains(SignalType.POST_INSTALL_PERMISSION_ESCALATION))) {
            signals.add(new TimelineSignal(TimelineSignalType.PERMISSION_ESCALATION,
                    "Permission escalation within " + formatAge(MEDIUM_WINDOW.toMillis()) + " of install",
                    WEIGHT_MEDIUM_ESCALATION, installAgeMs));
        }

        boolean bootReceiver = app.surface().exportedReceiverCount() > 0 && app.identity().isNewApp();
        if (signalTypes.contains(SignalType.BOOT_PERSISTENCE) || bootReceiver) {
            signals.add(new TimelineSignal(TimelineSignalType.BOOT_PERSISTENCE,
                    "Registers a boot completed receiver", WEIGHT_BOOT_PERSISTENCE, null));
        }
        if (signalTypes.contains(SignalType.DYNAMIC_CODE_LOADING)) {
            signals.add(new TimelineSignal(TimelineSignalType.DYNAMIC_CODE_LOADING,
                    "Dynamic code loading detected", WEIGHT_DYNAMIC_CODE_LOADING, null));
        }
        if (clusters.contains(CapabilityCluster.INSTALL_PACKAGES)) {
            signals.add(new TimelineSignal(TimelineSignalType.INSTALL_PACKAGES_CAPABILITY,
                    "Fresh app allowed to install further apps", WEIGHT_INSTALL_PACKAGES, installAgeMs));
        }

        TrustLevel level = app.identity().trustLevel();
        if (level == TrustLevel.LOW || level == TrustLevel.ANOMALOUS) {
            signals.add(new TimelineSignal(TimelineSignalType.LOW_TRUST_AMPLIFIER,
                    "Low app trust (" + app.identity().trustScore() + ")", WEIGHT_LOW_TRUST, null));
        }
        if (app.identity().installerType() == InstallerType.SIDELOADED) {
            signals.add(new TimelineSignal(TimelineSignalType.SIDELOAD_AMPLIFIER,
                    "Installed outside of a store", WEIGHT_SIDELOAD, null));
        }

        double raw = signals.stream().mapToDouble(TimelineSignal::weight).sum();
        double score = Math.max(0.0, Math.min(1.0, raw));
        log.debug("Timeline score for {}: {} ({} signals, phase {})", app.packageName(), score, signals.size(), phase);
        return new TimelineResult(app.packageName(), score, phase, List.copyOf(signals), true, installAgeMs);
    }

    /**
     * Results with a positive score only, highest first.
     */
    public List<TimelineResult> analyzeAll(List<AppFeatureVector> apps, List<SecurityEvent> recentEvents, Instant now) {
        return apps.stream()
                .map(app -> analyze(app, recentEvents, now))
                .filter(r -> r.score() > 0.0)
                .sorted(Comparator.comparingDouble(TimelineResult::score).reversed())
                .toList();
    }

    private static boolean hasEventInWindow(List<SecurityEvent> events, Instant installTime, Duration window) {
        long windowMs = window.toMillis();
        return events.stream().anyMatch(e -> {
            if (e.startTime() == null) return false;
            long offset = Duration.between(installTime, e.startTime()).toMillis();
            return offset >= 0 && offset <= windowMs;
        });
    }

    static String formatAge(long ageMs) {
        if (ageMs < 60_000) return (ageMs / 1000) + " s";
        if (ageMs < 3_600_000) return (ageMs / 60_000) + " min";
        if (ageMs < 86_400_000) return (ageMs / 3_600_000) + " h";
        return (ageMs / 86_400_000) + " d";
    }
}

package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.model.*;

import java.util.*;

/**
 * Deterministic hypothesis scoring. Each event type has a fixed set of candidate hypotheses with a
 * base confidence, adjusted by what is known about the package and the device. Confidence is
 * clamped to [0, 1] after every adjustment.
 */
@Slf4j
@Service
public class DefaultRootCauseResolver implements RootCauseResolver {

    static final double CORROBORATION_BOOST = 0.10;
    static final int CORROBORATION_MIN_EVENTS = 2;
    static final double UNINSTALL_CONFIDENCE = 0.7;

    private static final String DEVICE_KEY = "__device__";

    @Override
    public SecurityIncident resolve(SecurityEvent event,
                                    AppFeatureVector app,
                                    ConfigSnapshot config,
                                    List<SecurityEvent> recentEvents) {
        List<Hypothesis> hypotheses = new ArrayList<>(generateHypotheses(event, app, config,
                recentEvents != null ? recentEvents : List.of()));
        hypotheses.sort(Comparator.comparingDouble(Hypothesis::confidence).reversed());

        Hypothesis top = hypotheses.isEmpty() ? null : hypotheses.get(0);
        List<RecommendedAction> actions = generateActions(event, app, top);

        String id = StableIds.of("incident", event.id());
        log.debug("Resolved event {} ({}) to '{}'", event.id(), event.type(), top != null ? top.name() : event.summary());

        return new SecurityIncident(
                id,
                event.endTime(),
                event.endTime(),
                IncidentSeverity.from(event.severity()),
                IncidentStatus.OPEN,
                top != null ? top.name() : event.summary(),
                top != null ? top.description() : event.summary(),
                event.packageName(),
                event.packageName() != null ? List.of(event.packageName()) : List.of(),
                List.of(event),
                List.copyOf(hypotheses),
                actions
        );
    }

    @Override
    public List<SecurityIncident> resolveAll(List<SecurityEvent> events,
                                             Map<String, AppFeatureVector> appKnowledge,
                                             ConfigSnapshot config) {
        Map<String, List<SecurityEvent>> byPackage = new LinkedHashMap<>();
        for (SecurityEvent event : events) {
            String key = event.packageName() != null ? event.packageName() : DEVICE_KEY;
            byPackage.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        }

        Map<String, AppFeatureVector> knowledge = appKnowledge != null ? appKnowledge : Map.of();
        List<SecurityIncident> incidents = new ArrayList<>();
        byPackage.forEach((pkg, group) -> {
            AppFeatureVector app = DEVICE_KEY.equals(pkg) ? null : knowledge.get(pkg);
            List<SecurityEvent> others = events.stream().filter(e -> !group.contains(e)).toList();
            for (SecurityEvent event : group) {
                incidents.add(resolve(event, app, config, others));
            }
        });
        return incidents;
    }

    private List<Hypothesis> generateHypotheses(SecurityEvent event,
                                                AppFeatureVector app,
                                                ConfigSnapshot config,
                                                List<SecurityEvent> recentEvents) {
        List<Hypothesis> hypotheses = switch (event.type()) {
            case STALKERWARE_PATTERN -> List.of(stalkerware(app));
            case DROPPER_PATTERN -> List.of(dropper(app));
            case SUSPICIOUS_UPDATE -> List.of(supplyChain(app), legitimateUpdate(app));
            case CAPABILITY_ESCALATION -> List.of(escalation(), featureAdded(app));
            case SPECIAL_ACCESS_GRANT -> List.of(maliciousAccess(app), legitimateAccess(app));
            case CONFIG_TAMPER -> List.of(configTamper());
            case CA_CERT_INSTALLED -> List.of(mitm(config), corporate());
            case OVERLAY_ATTACK_PATTERN -> List.of(overlayAttack(app), bankingOverlay(app));
            case STAGED_PAYLOAD -> List.of(stagedPayload(app), dropper(app));
            case LOADER_BEHAVIOR -> List.of(loader(event, app), generic(event));
            case SUSPICIOUS_INSTALL, SUSPICIOUS_VPN, DEVICE_COMPROMISE, BEHAVIORAL_ANOMALY, OTHER ->
                    List.of(generic(event));
        };

        long sameApp = recentEvents.stream()
                .filter(e -> Objects.equals(e.packageName(), event.packageName()))
                .count();
        if (sameApp < CORROBORATION_MIN_EVENTS) return hypotheses;

        return hypotheses.stream()
                .map(h -> new Hypothesis(
                        h.name(),
                        h.description(),
                        clamp(h.confidence() + CORROBORATION_BOOST),
                        append(h.supportingEvidence(), "Several security events for this app in a short time"),
                        h.contradictingEvidence(),
                        h.mitreTechniques()))
                .toList();
    }

    private Hypothesis stalkerware(AppFeatureVector app) {
        Builder h = new Builder(0.7).support("Accessibility combined with notification access");
        if (app != null) {
            if (sideloaded(app)) h.add(0.15, "Sideloaded install");
            if (trust(app) < 40) {
                h.add(0.10, "Low trust (" + trust(app) + ")");
            } else {
                h.against(-0.15, "Higher trust (" + trust(app) + ")");
            }
        }
        return h.build("Stalkerware / surveillance app",
                "The app has the capabilities typical for surveillance software",
                List.of("T1417", "T1513"));
    }

    private Hypothesis dropper(AppFeatureVector app) {
        Builder h = new Builder(0.6).support("Accessibility combined with package installation");
        if (app != null) {
            if (trust(app) < 40) h.add(0.15, "Low trust (" + trust(app) + ")");
            if (sideloaded(app)) h.add(0.10, "Sideloaded install");
            if (app.identity().isNewApp()) h.add(0.10, "Freshly installed app");
            if (hasCluster(app, CapabilityCluster.OVERLAY)) h.add(0.10, "Overlay permission, possible banking attack");
            if (trust(app) >= 70) h.against(-0.20, "Higher trust (" + trust(app) + ")");
        }
        return h.build("Dropper / malware installer",
                "The app may silently install malicious packages",
                List.of("T1544"));
    }

    private Hypothesis supplyChain(AppFeatureVector app) {
        Builder h = new Builder(0.4).support("Suspicious update");
        if (app != null && app.change().isVersionRollback()) h.add(0.30, "Version went down (rollback)");
        return h.build("Supply-chain attack",
                "The app update may have been compromised",
                List.of("T1195"));
    }

    private Hypothesis legitimateUpdate(AppFeatureVector app) {
        Builder h = new Builder(0.3);
        if (app != null && trust(app) >= 70) h.add(0.40, "High developer trust");
        return h.build("Legitimate update", "Regular update from a known developer", List.of());
    }

    private Hypothesis escalation() {
        return new Builder(0.5).support("New high-risk permissions were added")
                .build("Privilege escalation", "The app acquired new dangerous capabilities", List.of("T1548"));
    }

    private Hypothesis featureAdded(AppFeatureVector app) {
        Builder h = new Builder(0.3).support("Common during app development");
        if (app != null && trust(app) >= 70) h.add(0.30, null);
        return h.build("New features added", "The developer added features that need new permissions", List.of());
    }

    private Hypothesis maliciousAccess(AppFeatureVector app) {
        Builder h = new Builder(0.4).support("Special access enabled");
        if (app != null && sideloaded(app)) h.add(0.20, "Sideloaded app");
        return h.build("Special access abuse",
                "Special access can be abused for surveillance or manipulation",
                List.of("T1628"));
    }

    private Hypothesis legitimateAccess(AppFeatureVector app) {
        Builder h = new Builder(0.3).support("Enabled by the user");
        if (app != null && trust(app) >= 70) h.add(0.40, null);
        return h.build("Legitimate special access", "The user granted access to a trusted app", List.of());
    }

    private Hypothesis configTamper() {
        return new Builder(0.5).support("Configuration change detected")
                .build("Device configuration tampering",
                        "Device settings changed in a way that can weaken security", List.of());
    }

    private Hypothesis mitm(ConfigSnapshot config) {
        Builder h = new Builder(0.5).support("User CA certificate installed");
        if (config != null && config.isVpnActive()) h.add(0.20, "VPN active at the same time");
        return h.build("Man-in-the-middle interception",
                "The CA certificate allows interception of encrypted traffic",
                List.of("T1557"));
    }

    private Hypothesis corporate() {
        return new Builder(0.4).support("Common in corporate environments")
                .build("Corporate / MDM configuration",
                        "The CA certificate was installed for corporate use", List.of());
    }

    private Hypothesis overlayAttack(AppFeatureVector app) {
        Builder h = new Builder(0.6).support("Overlay with low trust");
        if (app != null) {
            if (sideloaded(app)) h.add(0.15, "Sideloaded app");
            if (trust(app) < 40) h.add(0.10, "Low trust (" + trust(app) + ")");
            if (trust(app) >= 70) h.against(-0.20, "Higher trust (" + trust(app) + ")");
        }
        return h.build("Overlay / phishing attack",
                "The app can draw a fake UI over other apps",
                List.of("T1660"));
    }

    private Hypothesis bankingOverlay(AppFeatureVector app) {
        Builder h = new Builder(0.45).support("Overlay permission with a suspicious profile");
        if (app != null) {
            if (hasCluster(app, CapabilityCluster.ACCESSIBILITY)) {
                h.add(0.20, "Accessibility plus overlay matches a banking trojan");
            }
            if (sideloaded(app)) h.add(0.15, "Sideloaded install");
            if (trust(app) < 40) h.add(0.10, "Low trust (" + trust(app) + ")");
            if (app.identity().isNewApp()) h.add(0.10, "Freshly installed app");
            if (trust(app) >= 70) h.against(-0.25, "Higher trust (" + trust(app) + ")");
        }
        return h.build("Banking overlay attack",
                "The app shows the banking trojan pattern of overlays over financial apps",
                List.of("T1660", "T1417"));
    }

    private Hypothesis stagedPayload(AppFeatureVector app) {
        Builder h = new Builder(0.55).support("Install followed by permission escalation");
        if (app != null) {
            if (app.identity().isNewApp()) h.add(0.15, "Freshly installed app");
            if (hasCluster(app, CapabilityCluster.INSTALL_PACKAGES)) h.add(0.15, "Can install other apps");
            if (sideloaded(app)) h.add(0.10, "Sideloaded install");
            if (trust(app) < 40) h.add(0.10, "Low trust (" + trust(app) + ")");
            if (trust(app) >= 70) h.against(-0.25, "Higher app trust");
        }
        return h.build("Staged payload dropper",
                "The app looked harmless at first and escalated permissions later",
                List.of("T1544", "T1407"));
    }

    private Hypothesis loader(SecurityEvent event, AppFeatureVector app) {
        Builder h = new Builder(0.5).support("Dynamic code loading detected after install");
        if (app != null) {
            if (app.identity().isNewApp()) h.add(0.15, "Freshly installed app");
            if (sideloaded(app)) h.add(0.15, "Sideloaded install");
            if (trust(app) < 40) h.add(0.10, "Low trust (" + trust(app) + ")");
            boolean networkBurst = event.hasSignal(SignalType.NETWORK_BURST_ANOMALY)
                    || event.hasSignal(SignalType.NETWORK_AFTER_INSTALL);
            if (networkBurst) h.add(0.15, "Network traffic after install, payload download");
            if (trust(app) >= 70) h.against(-0.20, "Higher app trust");
        }
        return h.build("Loader / dynamic downloader",
                "The app behaves like a loader that downloads and runs code at runtime",
                List.of("T1407", "T1544"));
    }

    private Hypothesis generic(SecurityEvent event) {
        return new Builder(0.3).support("Detected automatically")
                .build("Security anomaly", event.summary(), List.of());
    }

    private List<RecommendedAction> generateActions(SecurityEvent event, AppFeatureVector app, Hypothesis top) {
        List<RecommendedAction> actions = new ArrayList<>();
        String pkg = event.packageName();

        if (top != null && top.confidence() > UNINSTALL_CONFIDENCE && pkg != null) {
            actions.add(new RecommendedAction(1, ActionCategory.UNINSTALL,
                    "Uninstall the app", "Uninstalling this suspicious app is recommended", pkg));
        }
        if (app != null && app.hasActiveSpecialAccess() && pkg != null) {
            actions.add(new RecommendedAction(2, ActionCategory.REVOKE_SPECIAL_ACCESS,
                    "Revoke special access", "Disable the special access in system settings", pkg));
        }
        if (event.type() == EventType.CONFIG_TAMPER || event.type() == EventType.CA_CERT_INSTALLED) {
            actions.add(new RecommendedAction(1, ActionCategory.CHECK_SETTINGS,
                    "Check settings", "Review the security settings of the device", null));
        }
        actions.add(new RecommendedAction(actions.size() + 1, ActionCategory.MONITOR,
                "Monitor", "Keep watching this app or situation in the next scans", null));
        return List.copyOf(actions);
    }

    private static int trust(AppFeatureVector app) {
        return app.identity().trustScore();
    }

    private static boolean sideloaded(AppFeatureVector app) {
        return app.identity().installerType() == InstallerType.SIDELOADED;
    }

    private static boolean hasCluster(AppFeatureVector app, CapabilityCluster cluster) {
        return app.capability().activeHighRiskClusters().contains(cluster);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> append(List<String> list, String item) {
        List<String> copy = new ArrayList<>(list);
        copy.add(item);
        return List.copyOf(copy);
    }

    private static final class Builder {
        private double confidence;
        private final List<String> supporting = new ArrayList<>();
        private final List<String> contradicting = new ArrayList<>();

        Builder(double base) {
            this.confidence = clamp(base);
        }

        Builder support(String evidence) {
            supporting.add(evidence);
            return this;
        }

        Builder add(double delta, String evidence) {
            confidence = clamp(confidence + delta);
            if (evidence != null) supporting.add(evidence);
            return this;
        }

        Builder against(double delta, String evidence) {
            confidence = clamp(confidence + delta);
            contradicting.add(evidence);
            return this;
        }

        Hypothesis build(String name, String description, List<String> mitre) {
            return new Hypothesis(name, description, confidence,
                    List.copyOf(supporting), List.copyOf(contradicting), mitre);
        }
    }
}

package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.DangerousComboCatalog;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.repository.SecurityEventRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns scan outputs into signals and groups them into events. Ids are derived from the source and
 * the package, so re-scanning the same state replaces events instead of duplicating them. Baseline
 * drift ids also cover the anomaly details, so a second certificate change is a new event.
 */
@Slf4j
@Service
public class EventRecorder {

    private final SecurityEventRepository eventRepository;
    private final DangerousComboCatalog comboCatalog;
    private final Duration retention;

    public EventRecorder(SecurityEventRepository eventRepository,
                         DangerousComboCatalog comboCatalog,
                         @Value("${risk-engine.events.retention-days:30}") int retentionDays) {
        this.eventRepository = eventRepository;
        this.comboCatalog = comboCatalog;
        this.retention = Duration.ofDays(retentionDays);
    }

    public List<SecuritySignal> anomalySignals(BaselineComparison comparison, Instant now) {
        List<SecuritySignal> signals = new ArrayList<>();
        for (BaselineAnomaly anomaly : comparison.anomalies()) {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("anomalyType", anomaly.type().name());
            if (anomaly.details() != null && !anomaly.details().isBlank()) details.put("details", anomaly.details());
            details.put("scanCount", String.valueOf(comparison.scanCount()));
            details.put("isFirstScan", String.valueOf(comparison.isFirstScan()));
            signals.add(new SecuritySignal(
                    StableIds.of("signal", "baseline:" + comparison.packageName() + "_" + anomalyKey(anomaly)),
                    now,
                    SignalSource.BASELINE,
                    signalTypeFor(anomaly.type()),
                    SignalSeverity.from(anomaly.severity()),
                    comparison.packageName(),
                    anomaly.description(),
                    Collections.unmodifiableMap(details)));
        }
        return signals;
    }

    /**
     * One event per package and event type, carrying the anomaly signals that map to that type.
     */
    public List<SecurityEvent> recordBaselineAnomalies(BaselineComparison comparison, Instant now) {
        Map<EventType, List<SecuritySignal>> grouped = new EnumMap<>(EventType.class);
        List<SecuritySignal> signals = anomalySignals(comparison, now);
        for (int i = 0; i < signals.size(); i++) {
            EventType type = eventTypeFor(comparison.anomalies().get(i).type());
            grouped.computeIfAbsent(type, t -> new ArrayList<>()).add(signals.get(i));
        }

        List<SecurityEvent> events = new ArrayList<>();
        grouped.forEach((type, group) -> {
            Map<String, String> metadata = Map.of(
                    "scanCount", String.valueOf(comparison.scanCount()),
                    "isFirstScan", String.valueOf(comparison.isFirstScan()));
            String content = group.stream()
                    .map(SecuritySignal::id)
                    .sorted()
                    .collect(Collectors.joining(","));
            events.add(save(new SecurityEvent(
                    StableIds.of("baseline", comparison.packageName() + "_" + type + "_" + content),
                    now, now,
                    SignalSource.BASELINE,
                    type,
                    maxSeverity(group),
                    comparison.packageName(),
                    group.get(0).summary(),
                    List.copyOf(group),
                    metadata,
                    false)));
        });
        return events;
    }

    private static String anomalyKey(BaselineAnomaly anomaly) {
        return anomaly.details() != null ? anomaly.type() + ":" + anomaly.details() : anomaly.type().name();
    }

    public List<SecurityEvent> recordCombos(AppVerdict verdict, Instant now) {
        List<SecurityEvent> events = new ArrayList<>();
        for (String combo : verdict.matchedCombos()) {
            String key = verdict.packageName() + "_" + combo;
            SecuritySignal signal = new SecuritySignal(
                    StableIds.of("signal", "combo:" + key),
                    now,
                    SignalSource.TRUST_ENGINE,
                    SignalType.COMBO_DETECTED,
                    comboSeverity(combo),
                    verdict.packageName(),
                    combo,
                    Map.of("trustScore", String.valueOf(verdict.trustScore())));
            events.add(save(new SecurityEvent(
                    StableIds.of("combo", key),
                    now, now,
                    SignalSource.TRUST_ENGINE,
                    eventTypeForCombo(combo),
                    signal.severity(),
                    verdict.packageName(),
                    combo,
                    List.of(signal),
                    Map.of("combo", combo),
                    false)));
        }
        return events;
    }

    public Optional<SecurityEvent> recordSpecialAccess(SpecialAccessSnapshot snapshot, Instant now) {
        if (snapshot == null || !snapshot.hasAnySpecialAccess()) return Optional.empty();

        String labels = String.join(", ", snapshot.activeLabels());
        SecuritySignal signal = new SecuritySignal(
                StableIds.of("signal", "special:" + snapshot.packageName()),
                now,
                SignalSource.SPECIAL_ACCESS,
                SignalType.SPECIAL_ACCESS_ENABLED,
                SignalSeverity.MEDIUM,
                snapshot.packageName(),
                "Special access: " + labels,
                Map.of());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("accessibility", String.valueOf(snapshot.accessibilityEnabled()));
        metadata.put("notificationListener", String.valueOf(snapshot.notificationListenerEnabled()));
        metadata.put("deviceAdmin", String.valueOf(snapshot.deviceAdminEnabled()));
        metadata.put("overlay", String.valueOf(snapshot.overlayEnabled()));
        metadata.put("defaultSms", String.valueOf(snapshot.isDefaultSms()));
        metadata.put("defaultDialer", String.valueOf(snapshot.isDefaultDialer()));
        metadata.put("batteryOptIgnored", String.valueOf(snapshot.batteryOptimizationIgnored()));
        metadata.put("activeCount", String.valueOf(snapshot.activeCount()));

        return Optional.of(save(new SecurityEvent(
                StableIds.of("special", snapshot.packageName()),
                now, now,
                SignalSource.SPECIAL_ACCESS,
                EventType.SPECIAL_ACCESS_GRANT,
                SignalSeverity.MEDIUM,
                snapshot.packageName(),
                signal.summary(),
                List.of(signal),
                Collections.unmodifiableMap(metadata),
                false)));
    }

    public Optional<SecurityEvent> recordConfigDelta(ConfigDelta delta, List<SecuritySignal> signals, Instant now) {
        if (!delta.hasChanges()) return Optional.empty();

        boolean caAdded = delta.changes().stream().anyMatch(c -> c.type() == ConfigChangeType.CA_CERT_ADDED);
        EventType type = caAdded ? EventType.CA_CERT_INSTALLED : EventType.CONFIG_TAMPER;
        String summary = delta.changes().size() == 1
                ? delta.changes().get(0).description()
                : delta.changes().size() + " device configuration changes";

        return Optional.of(save(new SecurityEvent(
                StableIds.of("config", String.valueOf(delta.newHash())),
                now, now,
                SignalSource.CONFIG_BASELINE,
                type,
                delta.maxSeverity(),
                null,
                summary,
                List.copyOf(signals),
                Map.of("oldHash", String.valueOf(delta.oldHash()), "newHash", String.valueOf(delta.newHash())),
                false)));
    }

    /**
     * Scanner findings that have a signal of their own and would otherwise leave no trace on a
     * first scan, when there is no baseline drift to report.
     */
    public Optional<SecurityEvent> recordScannerFindings(AppVerdict verdict, Instant now) {
        List<SecuritySignal> signals = new ArrayList<>();
        for (AdjustedFinding finding : verdict.adjustedFindings()) {
            SignalType type = switch (finding.findingType()) {
                case DEBUG_SIGNATURE -> SignalType.DEBUG_SIGNATURE;
                case SUSPICIOUS_NATIVE_LIB -> SignalType.SUSPICIOUS_NATIVE_LIB;
                default -> null;
            };
            if (type == null || !finding.isVisible()) continue;
            signals.add(new SecuritySignal(
                    StableIds.of("signal", "scanner:" + verdict.packageName() + "_" + type),
                    now,
                    SignalSource.APP_SCANNER,
                    type,
                    SignalSeverity.from(finding.adjustedSeverity()),
                    verdict.packageName(),
                    finding.title(),
                    finding.description() != null ? Map.of("description", finding.description()) : Map.of()));
        }
        if (signals.isEmpty()) return Optional.empty();

        return Optional.of(save(new SecurityEvent(
                StableIds.of("scanner", verdict.packageName()),
                now, now,
                SignalSource.APP_SCANNER,
                EventType.SUSPICIOUS_INSTALL,
                maxSeverity(signals),
                verdict.packageName(),
                signals.get(0).summary(),
                List.copyOf(signals),
                Map.of("effectiveRisk", verdict.effectiveRisk().name()),
                false)));
    }

    /**
     * Records a dropper-like install timeline. Dynamic code loading makes it a loader event,
     * otherwise it is a staged payload.
     */
    public SecurityEvent recordTimeline(TimelineResult timeline, Instant now) {
        List<SecuritySignal> signals = new ArrayList<>();
        for (TimelineSignal ts : timeline.signals()) {
            SignalType type = switch (ts.type()) {
                case NETWORK_BURST_AFTER_INSTALL -> SignalType.NETWORK_AFTER_INSTALL;
                case DYNAMIC_CODE_LOADING -> SignalType.DYNAMIC_CODE_LOADING;
                case BOOT_PERSISTENCE -> SignalType.BOOT_PERSISTENCE;
                case PERMISSION_ESCALATION -> SignalType.POST_INSTALL_PERMISSION_ESCALATION;
                case SMS_ACCESS_AFTER_INSTALL, ACCESSIBILITY_AFTER_INSTALL, OVERLAY_AFTER_INSTALL,
                        INSTALL_PACKAGES_CAPABILITY -> SignalType.FRESH_INSTALL_RISKY_PERM;
                case FRESH_INSTALL, LOW_TRUST_AMPLIFIER, SIDELOAD_AMPLIFIER -> SignalType.STAGED_PAYLOAD_PATTERN;
            };
            signals.add(new SecuritySignal(
                    StableIds.of("signal", "timeline:" + timeline.packageName() + "_" + ts.type()),
                    now,
                    SignalSource.INSTALL_TIMELINE,
                    type,
                    SignalSeverity.LOW,
                    timeline.packageName(),
                    ts.description(),
                    Map.of("weight", String.valueOf(ts.weight()))));
        }

        EventType type = timeline.hasSignal(TimelineSignalType.DYNAMIC_CODE_LOADING)
                ? EventType.LOADER_BEHAVIOR
                : EventType.STAGED_PAYLOAD;
        SignalSeverity severity = timeline.isHighConfidenceDropper() ? SignalSeverity.HIGH : SignalSeverity.MEDIUM;

        return save(new SecurityEvent(
                StableIds.of("timeline", timeline.packageName()),
                now, now,
                SignalSource.INSTALL_TIMELINE,
                type,
                severity,
                timeline.packageName(),
                String.format(Locale.ROOT, "Dropper-like install timeline (score %.2f)", timeline.score()),
                List.copyOf(signals),
                Map.of("phase", timeline.phase().name(), "score", String.valueOf(timeline.score())),
                false));
    }

    public SecurityEvent promote(SecurityEvent event) {
        return save(event.promoted());
    }

    public List<SecurityEvent> recentEvents(Instant now, Duration window) {
        return eventRepository.findSince(now.minus(window));
    }

    public List<SecurityEvent> allEvents() {
        return eventRepository.findAll();
    }

    /**
     * Drops events that started before the retention window. Returns how many were removed.
     */
    public int pruneExpired(Instant now) {
        int removed = eventRepository.deleteOlderThan(now.minus(retention));
        if (removed > 0) {
            log.info("Pruned {} expired security event(s)", removed);
        }
        return removed;
    }

    static SignalType signalTypeFor(AnomalyType type) {
        return switch (type) {
            case CERT_CHANGED -> SignalType.CERT_CHANGE;
            case VERSION_ROLLBACK -> SignalType.VERSION_ROLLBACK;
            case INSTALLER_CHANGED -> SignalType.INSTALLER_CHANGE;
            case HIGH_RISK_PERMISSION_ADDED, PERMISSION_SET_CHANGED -> SignalType.HIGH_RISK_PERM_ADDED;
            case EXPORTED_SURFACE_INCREASED -> SignalType.EXPORTED_SURFACE_CHANGE;
            case NEW_SYSTEM_APP, VERSION_CHANGED, PARTITION_CHANGED -> SignalType.NEW_APP_INSTALLED;
        };
    }

    static EventType eventTypeFor(AnomalyType type) {
        return switch (type) {
            case CERT_CHANGED, VERSION_ROLLBACK -> EventType.SUSPICIOUS_UPDATE;
            case INSTALLER_CHANGED, NEW_SYSTEM_APP -> EventType.SUSPICIOUS_INSTALL;
            case HIGH_RISK_PERMISSION_ADDED, EXPORTED_SURFACE_INCREASED,
                    PERMISSION_SET_CHANGED -> EventType.CAPABILITY_ESCALATION;
            case PARTITION_CHANGED -> EventType.DEVICE_COMPROMISE;
            case VERSION_CHANGED -> EventType.OTHER;
        };
    }

    static EventType eventTypeForCombo(String comboName) {
        return switch (comboName) {
            case DangerousComboCatalog.STALKERWARE, DangerousComboCatalog.STALKERWARE_SIDELOADED,
                    DangerousComboCatalog.SMS_CALL_LOG_LOW_TRUST -> EventType.STALKERWARE_PATTERN;
            case DangerousComboCatalog.DROPPER, DangerousComboCatalog.SIDELOADED_INSTALLER -> EventType.DROPPER_PATTERN;
            case DangerousComboCatalog.OVERLAY_ACCESSIBILITY_SIDELOAD,
                    DangerousComboCatalog.NOTIFICATION_OVERLAY -> EventType.OVERLAY_ATTACK_PATTERN;
            case DangerousComboCatalog.SIDELOADED_VPN -> EventType.SUSPICIOUS_VPN;
            case DangerousComboCatalog.DEVICE_ADMIN_ACCESSIBILITY -> EventType.DEVICE_COMPROMISE;
            default -> EventType.SUSPICIOUS_INSTALL;
        };
    }

    private SignalSeverity comboSeverity(String comboName) {
        return comboCatalog.combos().stream()
                .filter(c -> c.name().equals(comboName))
                .findFirst()
                .map(c -> SignalSeverity.from(c.severity()))
                .orElse(SignalSeverity.MEDIUM);
    }

    private static SignalSeverity maxSeverity(List<SecuritySignal> signals) {
        return signals.stream()
                .map(SecuritySignal::severity)
                .max(Comparator.comparingInt(SignalSeverity::weight))
                .orElse(SignalSeverity.INFO);
    }

    private SecurityEvent save(SecurityEvent event) {
        return eventRepository.save(event);
    }
}

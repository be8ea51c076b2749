package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.model.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static tech.noetzold.risk_engine.service.FeatureVectors.*;

class DefaultRootCauseResolverTest {

    private static final String PKG = "com.spy.tracker";

    private final DefaultRootCauseResolver resolver = new DefaultRootCauseResolver();

    private static List<ActionCategory> actions(SecurityIncident incident) {
        return incident.recommendedActions().stream().map(RecommendedAction::type).toList();
    }

    @Test
    void sideloadedStalkerwareIsConfidentAndRecommendsUninstall() {
        SpecialAccessSnapshot snapshot = new SpecialAccessSnapshot(PKG, true, true, false, false, false, false, false);
        AppFeatureVector app = vector(PKG, 10, InstallerType.SIDELOADED, false, Set.of(), snapshot, null, 0);
        SecurityEvent event = event("ev-1", EventType.STALKERWARE_PATTERN, SignalSeverity.HIGH, PKG, NOW);

        SecurityIncident incident = resolver.resolve(event, app, null, List.of());

        assertEquals(StableIds.of("incident", "ev-1"), incident.id());
        assertEquals(IncidentStatus.OPEN, incident.status());
        assertEquals(IncidentSeverity.HIGH, incident.severity());
        assertEquals(NOW, incident.createdAt());
        assertEquals("Stalkerware / surveillance app", incident.title());
        assertEquals(0.95, incident.topHypothesis().confidence(), 1e-9);
        assertEquals(List.of(ActionCategory.UNINSTALL, ActionCategory.REVOKE_SPECIAL_ACCESS, ActionCategory.MONITOR),
                actions(incident));
        assertEquals(3, incident.recommendedActions().get(2).priority());
        assertEquals(List.of(PKG), incident.affectedPackages());
    }

    @Test
    void trustedAppLowersStalkerwareConfidenceBelowUninstall() {
        AppFeatureVector app = vector(PKG, 80, InstallerType.PLAY_STORE);
        SecurityEvent event = event("ev-2", EventType.STALKERWARE_PATTERN, SignalSeverity.HIGH, PKG, NOW);

        SecurityIncident incident = resolver.resolve(event, app, null, List.of());

        assertEquals(0.55, incident.topHypothesis().confidence(), 1e-9);
        assertEquals(List.of("Higher trust (80)"), incident.topHypothesis().contradictingEvidence());
        assertEquals(List.of(ActionCategory.MONITOR), actions(incident));
    }

    @Test
    void hypothesesAreRankedByConfidence() {
        AppFeatureVector app = vector(PKG, 80, InstallerType.PLAY_STORE);
        SecurityEvent event = event("ev-3", EventType.SUSPICIOUS_UPDATE, SignalSeverity.MEDIUM, PKG, NOW);

        SecurityIncident incident = resolver.resolve(event, app, null, List.of());

        assertEquals(List.of("Legitimate update", "Supply-chain attack"),
                incident.hypotheses().stream().map(Hypothesis::name).toList());
        assertEquals("Legitimate update", incident.title());
    }

    @Test
    void caCertificateWithActiveVpnFavoursInterception() {
        ConfigSnapshot config = ConfigSnapshot.builder().vpnActive(true).vpnPackage("com.unknown.vpn").build();
        SecurityEvent event = event("ev-4", EventType.CA_CERT_INSTALLED, SignalSeverity.HIGH, null, NOW);

        SecurityIncident incident = resolver.resolve(event, null, config, List.of());

        assertEquals("Man-in-the-middle interception", incident.title());
        assertEquals(0.7, incident.topHypothesis().confidence(), 1e-9);
        assertTrue(incident.affectedPackages().isEmpty());
        assertEquals(List.of(ActionCategory.CHECK_SETTINGS, ActionCategory.MONITOR), actions(incident));
    }

    @Test
    void severalRecentEventsForTheSameAppCorroborate() {
        SecurityEvent event = event("ev-5", EventType.SUSPICIOUS_INSTALL, SignalSeverity.MEDIUM, PKG, NOW);
        List<SecurityEvent> recent = List.of(
                event("r-1", EventType.CAPABILITY_ESCALATION, SignalSeverity.HIGH, PKG, NOW),
                event("r-2", EventType.SPECIAL_ACCESS_GRANT, SignalSeverity.MEDIUM, PKG, NOW),
                event("r-3", EventType.SPECIAL_ACCESS_GRANT, SignalSeverity.MEDIUM, "com.other", NOW));

        Hypothesis corroborated = resolver.resolve(event, null, null, recent).topHypothesis();
        Hypothesis alone = resolver.resolve(event, null, null, recent.subList(1, 3)).topHypothesis();

        assertEquals(0.4, corroborated.confidence(), 1e-9);
        assertTrue(corroborated.supportingEvidence().contains("Several security events for this app in a short time"));
        assertEquals(0.3, alone.confidence(), 1e-9);
    }

    @Test
    void confidenceIsClampedToOne() {
        AppFeatureVector app = vector(PKG, 10, InstallerType.SIDELOADED, true,
                Set.of(CapabilityCluster.OVERLAY, CapabilityCluster.ACCESSIBILITY), null, null, 0);
        SecurityEvent event = event("ev-6", EventType.DROPPER_PATTERN, SignalSeverity.CRITICAL, PKG, NOW);

        SecurityIncident incident = resolver.resolve(event, app, null, List.of());

        assertEquals(1.0, incident.topHypothesis().confidence(), 1e-9);
        assertEquals(IncidentSeverity.CRITICAL, incident.severity());
    }

    @Test
    void loaderConfidenceRisesWithNetworkBurst() {
        AppFeatureVector app = vector(PKG, 50, InstallerType.PLAY_STORE);
        SecurityEvent quiet = event("ev-7", EventType.LOADER_BEHAVIOR, SignalSeverity.HIGH, PKG, NOW,
                signal(SignalType.DYNAMIC_CODE_LOADING, PKG, NOW));
        SecurityEvent noisy = event("ev-8", EventType.LOADER_BEHAVIOR, SignalSeverity.HIGH, PKG, NOW,
                signal(SignalType.DYNAMIC_CODE_LOADING, PKG, NOW),
                signal(SignalType.NETWORK_AFTER_INSTALL, PKG, NOW));

        assertEquals(0.5, resolver.resolve(quiet, app, null, List.of()).topHypothesis().confidence(), 1e-9);
        assertEquals(0.65, resolver.resolve(noisy, app, null, List.of()).topHypothesis().confidence(), 1e-9);
    }

    @Test
    void resolveAllKeepsPackageGroupsAndDeviceEvents() {
        AppFeatureVector app = vector(PKG, 10, InstallerType.SIDELOADED);
        List<SecurityEvent> events = List.of(
                event("a-1", EventType.STALKERWARE_PATTERN, SignalSeverity.HIGH, PKG, NOW),
                event("d-1", EventType.CONFIG_TAMPER, SignalSeverity.MEDIUM, null, NOW),
                event("a-2", EventType.SPECIAL_ACCESS_GRANT, SignalSeverity.MEDIUM, PKG, NOW));

        List<SecurityIncident> incidents = resolver.resolveAll(events, Map.of(PKG, app), null);

        assertEquals(3, incidents.size());
        assertEquals(List.of(PKG, PKG), incidents.subList(0, 2).stream().map(SecurityIncident::packageName).toList());
        assertNull(incidents.get(2).packageName());
        assertEquals("Device configuration tampering", incidents.get(2).title());
        // sideloaded low trust: 0.7 + 0.15 + 0.10
        assertEquals(0.95, incidents.get(0).topHypothesis().confidence(), 1e-9);
    }
}

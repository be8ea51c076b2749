package tech.noetzold.risk_engine.service;

import tech.noetzold.risk_engine.model.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hand-built feature vectors and events for the correlation tests.
 */
final class FeatureVectors {

    static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");

    private FeatureVectors() {}

    static AppFeatureVector vector(String packageName, int trustScore, InstallerType installer, boolean isNewApp,
                                   Set<CapabilityCluster> clusters, SpecialAccessSnapshot snapshot,
                                   Instant lastUpdateAt, int exportedReceivers) {
        AppFeatureVector.IdentityFeatures identity = new AppFeatureVector.IdentityFeatures(
                trustScore, TrustLevel.fromScore(trustScore), "UNKNOWN", CertMatchType.UNKNOWN, null,
                installer, "installer", false, false, false, isNewApp);
        AppFeatureVector.ChangeFeatures change = new AppFeatureVector.ChangeFeatures(
                isNewApp ? BaselineStatus.NEW : BaselineStatus.UNCHANGED, false, List.of(), lastUpdateAt,
                null, null, null, 1, "1.0", false);
        AppFeatureVector.CapabilityFeatures capability = new AppFeatureVector.CapabilityFeatures(
                clusters.isEmpty() ? EnumSet.noneOf(CapabilityCluster.class) : EnumSet.copyOf(clusters),
                Set.of(), 0, List.of(), List.of(), List.of(), AppCategory.OTHER);
        AppFeatureVector.SurfaceFeatures surface = new AppFeatureVector.SurfaceFeatures(
                0, 0, exportedReceivers, 0, 0, false, 0, 33, 26, 1_000_000L);
        AppFeatureVector.VerdictSummary verdict = new AppFeatureVector.VerdictSummary(
                EffectiveRisk.INFO, 0, 0, 0, List.of());
        return new AppFeatureVector(packageName, NOW, identity, change, capability, surface,
                snapshot != null ? snapshot : SpecialAccessSnapshot.none(packageName), verdict);
    }

    static AppFeatureVector vector(String packageName, int trustScore, InstallerType installer) {
        return vector(packageName, trustScore, installer, false, Set.of(), null, null, 0);
    }

    static SecurityEvent event(String id, EventType type, SignalSeverity severity, String packageName,
                               Instant at, SecuritySignal... signals) {
        return new SecurityEvent(id, at, at, SignalSource.BASELINE, type, severity, packageName,
                type + " for " + packageName, List.of(signals), Map.of(), false);
    }

    static SecuritySignal signal(SignalType type, String packageName, Instant at) {
        return new SecuritySignal("sig-" + type + "-" + packageName, at, SignalSource.APP_SCANNER, type,
                SignalSeverity.LOW, packageName, type.name(), Map.of());
    }
}

package tech.noetzold.risk_engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Everything known about one package after a scan, flattened for the correlation layer.
 */
public record AppFeatureVector(
        String packageName,
        Instant timestamp,
        IdentityFeatures identity,
        ChangeFeatures change,
        CapabilityFeatures capability,
        SurfaceFeatures surface,
        SpecialAccessSnapshot specialAccess,
        VerdictSummary verdict
) {

    public record IdentityFeatures(
            int trustScore,
            TrustLevel trustLevel,
            String certSha256,
            CertMatchType certMatchType,
            String matchedDeveloper,
            InstallerType installerType,
            String installerPackage,
            boolean isSystemApp,
            boolean isPlatformSigned,
            boolean hasSigningLineage,
            boolean isNewApp
    ) {}

    public record ChangeFeatures(
            BaselineStatus baselineStatus,
            boolean isFirstScan,
            List<AnomalyType> anomalies,
            Instant lastUpdateAt,
            Instant lastInstallerChangeAt,
            Instant lastHighRiskPermAddedAt,
            Instant lastSpecialAccessEnabledAt,
            long versionCode,
            String versionName,
            boolean isVersionRollback
    ) {}

    public record CapabilityFeatures(
            Set<CapabilityCluster> activeHighRiskClusters,
            Set<CapabilityCluster> unexpectedClusters,
            int dangerousPermissionCount,
            List<String> highRiskPermissions,
            List<String> privacyCapabilities,
            List<String> matchedCombos,
            AppCategory appCategory
    ) {}

    public record SurfaceFeatures(
            int exportedActivityCount,
            int exportedServiceCount,
            int exportedReceiverCount,
            int exportedProviderCount,
            int unprotectedExportedCount,
            boolean hasSuspiciousNativeLibs,
            int nativeLibCount,
            int targetSdk,
            int minSdk,
            long apkSizeBytes
    ) {}

    public record VerdictSummary(
            EffectiveRisk effectiveRisk,
            int riskScore,
            int hardFindingCount,
            int softFindingCount,
            List<String> topReasons
    ) {}

    public boolean hasActiveSpecialAccess() {
        return specialAccess != null && specialAccess.hasAnySpecialAccess();
    }

    public boolean isHighPriorityTarget() {
        return identity.trustScore() < 40 && hasActiveSpecialAccess();
    }

    public boolean hasRecentChanges(Instant now, Duration window) {
        Instant since = now.minus(window);
        return isAfter(change.lastUpdateAt(), since)
                || isAfter(change.lastInstallerChangeAt(), since)
                || isAfter(change.lastHighRiskPermAddedAt(), since)
                || isAfter(change.lastSpecialAccessEnabledAt(), since);
    }

    public boolean hasSuspiciousProfile() {
        return identity.trustLevel() == TrustLevel.ANOMALOUS
                || !capability.matchedCombos().isEmpty()
                || verdict.hardFindingCount() > 0
                || (identity.trustScore() < 40 && !capability.unexpectedClusters().isEmpty());
    }

    public boolean shouldMonitor() {
        return hasSuspiciousProfile() || isHighPriorityTarget()
                || change.isVersionRollback()
                || verdict.effectiveRisk() == EffectiveRisk.NEEDS_ATTENTION;
    }

    private static boolean isAfter(Instant instant, Instant since) {
        return instant != null && instant.isAfter(since);
    }
}

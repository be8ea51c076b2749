package tech.noetzold.risk_engine.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_engine.catalog.AndroidPermissions;
import tech.noetzold.risk_engine.model.*;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class FeatureVectorBuilder {

    public AppFeatureVector build(ScannedAppEvidence app,
                                  TrustEvidence trust,
                                  BaselineComparison comparison,
                                  AppVerdict verdict,
                                  AppCategory category,
                                  SpecialAccessSnapshot snapshot,
                                  Instant now) {
        // every package is NEW on the very first scan, which says nothing about its age
        boolean isNewApp = comparison.status() == BaselineStatus.NEW && !comparison.isFirstScan();

        AppFeatureVector.IdentityFeatures identity = new AppFeatureVector.IdentityFeatures(
                trust.trustScore(),
                trust.trustLevel(),
                trust.certSha256(),
                trust.certMatch() != null ? trust.certMatch().matchType() : CertMatchType.UNKNOWN,
                trust.certMatch() != null ? trust.certMatch().matchedDeveloper() : null,
                trust.installerType(),
                app.getInstallerPackage(),
                app.isSystemApp(),
                app.isPlatformSigned(),
                app.isLineagePresent(),
                isNewApp);

        AppFeatureVector.ChangeFeatures change = new AppFeatureVector.ChangeFeatures(
                comparison.status(),
                comparison.isFirstScan(),
                comparison.anomalies().stream().map(BaselineAnomaly::type).toList(),
                app.getLastUpdateAt(),
                comparison.hasAnomaly(AnomalyType.INSTALLER_CHANGED) ? now : null,
                comparison.hasAnomaly(AnomalyType.HIGH_RISK_PERMISSION_ADDED) ? now : null,
                null,
                app.getVersionCode(),
                app.getVersionName(),
                comparison.hasAnomaly(AnomalyType.VERSION_ROLLBACK));

        List<String> highRisk = app.grantedOrEmpty().stream()
                .filter(AndroidPermissions::isHighRisk)
                .distinct()
                .sorted()
                .toList();
        Set<CapabilityCluster> activeHighRisk = EnumSet.noneOf(CapabilityCluster.class);
        verdict.activeClusters().stream().filter(CapabilityCluster::isHighRisk).forEach(activeHighRisk::add);

        AppFeatureVector.CapabilityFeatures capability = new AppFeatureVector.CapabilityFeatures(
                Collections.unmodifiableSet(activeHighRisk),
                verdict.unexpectedClusters(),
                highRisk.size(),
                highRisk,
                verdict.privacyCapabilities(),
                verdict.matchedCombos(),
                category);

        AppFeatureVector.SurfaceFeatures surface = new AppFeatureVector.SurfaceFeatures(
                app.getExportedActivityCount(),
                app.getExportedServiceCount(),
                app.getExportedReceiverCount(),
                app.getExportedProviderCount(),
                app.getUnprotectedExportedCount(),
                verdict.adjustedFindings().stream().anyMatch(f -> f.findingType() == FindingType.SUSPICIOUS_NATIVE_LIB),
                app.nativeLibsOrEmpty().size(),
                app.getTargetSdk(),
                app.getMinSdk(),
                app.getApkSizeBytes());

        AppFeatureVector.VerdictSummary summary = new AppFeatureVector.VerdictSummary(
                verdict.effectiveRisk(),
                verdict.riskScore(),
                (int) verdict.hardFindingCount(),
                (int) verdict.softFindingCount(),
                verdict.topReasons());

        return new AppFeatureVector(app.getPackageName(), now, identity, change, capability, surface,
                snapshot != null ? snapshot : SpecialAccessSnapshot.none(app.getPackageName()),
                summary);
    }
}

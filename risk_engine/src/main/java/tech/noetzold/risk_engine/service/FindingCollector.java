package tech.noetzold.risk_engine.service;

import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.AndroidPermissions;
import tech.noetzold.risk_engine.catalog.CategoryWhitelist;
import tech.noetzold.risk_engine.catalog.TrustedAppsCatalog;
import tech.noetzold.risk_engine.model.*;

import java.util.*;

/**
 * Produces the raw findings handed to the verdict engine: static findings read off the scanned
 * package, plus findings derived from baseline drift.
 */
@Service
public class FindingCollector {

    static final int OLD_TARGET_SDK_BELOW = 29;
    static final int VERY_OLD_TARGET_SDK_BELOW = 26;
    static final int OVER_PRIVILEGED_THRESHOLD = 5;

    private static final List<String> SUSPICIOUS_LIB_MARKERS =
            List.of("hide", "hook", "inject", "root", "frida", "xposed", "substrate");

    private final TrustedAppsCatalog catalog;
    private final CategoryWhitelist whitelist;

    public FindingCollector(TrustedAppsCatalog catalog, CategoryWhitelist whitelist) {
        this.catalog = catalog;
        this.whitelist = whitelist;
    }

    public List<RawFinding> staticFindings(ScannedAppEvidence app,
                                           TrustEvidence trust,
                                           AppCategory category,
                                           Set<CapabilityCluster> activeClusters) {
        List<RawFinding> findings = new ArrayList<>();

        if (app.isDebugSigned()) {
            findings.add(new RawFinding(FindingType.DEBUG_SIGNATURE, RiskLevel.HIGH,
                    "Signed with a debug certificate",
                    "Release builds are never signed with the Android debug key"));
        }

        List<String> suspiciousLibs = app.nativeLibsOrEmpty().stream()
                .filter(FindingCollector::isSuspiciousLib)
                .map(lib -> lib.name() != null ? lib.name() : "unnamed")
                .toList();
        if (!suspiciousLibs.isEmpty()) {
            findings.add(new RawFinding(FindingType.SUSPICIOUS_NATIVE_LIB, RiskLevel.HIGH,
                    "Suspicious native library",
                    "Native code typical for hooking or root hiding: " + String.join(", ", suspiciousLibs)));
        }

        int targetSdk = app.getTargetSdk();
        if (targetSdk > 0 && targetSdk < OLD_TARGET_SDK_BELOW) {
            RiskLevel severity = targetSdk < VERY_OLD_TARGET_SDK_BELOW ? RiskLevel.MEDIUM : RiskLevel.LOW;
            findings.add(new RawFinding(FindingType.OLD_TARGET_SDK, severity,
                    "Targets an old Android version",
                    "targetSdk " + targetSdk + " skips newer platform restrictions"));
        }

        if (app.getUnprotectedExportedCount() > 0) {
            findings.add(new RawFinding(FindingType.EXPORTED_COMPONENTS, RiskLevel.LOW,
                    "Unprotected exported components",
                    app.getUnprotectedExportedCount() + " exported component(s) without a permission"));
        }

        long unexpectedHighRisk = app.grantedOrEmpty().stream()
                .distinct()
                .filter(AndroidPermissions::isHighRisk)
                .filter(p -> !category.expects(p))
                .count();
        if (unexpectedHighRisk > OVER_PRIVILEGED_THRESHOLD) {
            findings.add(new RawFinding(FindingType.OVER_PRIVILEGED, RiskLevel.MEDIUM,
                    "More permissions than the app type needs",
                    unexpectedHighRisk + " high-risk permissions not typical for " + category));
        }

        boolean unknownSigner = trust.certMatch() == null || trust.certMatch().matchType() == CertMatchType.UNKNOWN;
        if (!app.isSystemApp() && unknownSigner && !trust.installerType().isExpected()) {
            findings.add(new RawFinding(FindingType.NOT_PLAY_SIGNED, RiskLevel.LOW,
                    "Unknown signer outside of a store",
                    "Neither the certificate nor the installer can be tied to a known source"));
        }

        if (catalog.detectPartitionAnomaly(app.isSystemApp(), app.isUpdatedSystemApp(),
                app.resolvedPartition(), app.getApkPath())) {
            findings.add(new RawFinding(FindingType.PARTITION_ANOMALY, RiskLevel.HIGH,
                    "System app running from the data partition",
                    "A non-updated system app is expected on a read-only partition, found " + app.getApkPath()));
        }

        for (CapabilityCluster cluster : activeClusters) {
            if (cluster.isHighRisk() && !whitelist.isExpected(cluster, category, trust.trustScore())) {
                findings.add(new RawFinding(FindingType.HIGH_RISK_CAPABILITY, RiskLevel.LOW,
                        cluster.label(),
                        cluster.label() + " is not typical for " + category));
            }
        }

        return findings;
    }

    /**
     * Maps drift anomalies to findings. The current installer decides whether a rollback or
     * installer change is treated as hard evidence.
     */
    public List<RawFinding> baselineFindings(BaselineComparison comparison, TrustEvidence trust, boolean isSystemApp) {
        boolean expectedInstaller = trust.installerType().isExpected();
        List<RawFinding> findings = new ArrayList<>();

        for (BaselineAnomaly anomaly : comparison.anomalies()) {
            RawFinding finding = switch (anomaly.type()) {
                case CERT_CHANGED -> new RawFinding(FindingType.BASELINE_SIGNATURE_CHANGE, RiskLevel.CRITICAL,
                        "Signing certificate changed", anomaly.description());
                case NEW_SYSTEM_APP -> new RawFinding(FindingType.BASELINE_NEW_SYSTEM_APP, RiskLevel.HIGH,
                        "New system app appeared", anomaly.description());
                case VERSION_ROLLBACK -> expectedInstaller
                        ? new RawFinding(FindingType.VERSION_ROLLBACK_TRUSTED, RiskLevel.MEDIUM,
                        "Version downgrade from a store", anomaly.description())
                        : new RawFinding(FindingType.VERSION_ROLLBACK, RiskLevel.HIGH,
                        "Version downgrade", anomaly.description());
                case INSTALLER_CHANGED -> installerChangeFinding(anomaly, trust);
                case PARTITION_CHANGED -> new RawFinding(FindingType.PARTITION_ANOMALY,
                        isSystemApp ? RiskLevel.LOW : RiskLevel.MEDIUM,
                        "APK moved to another partition", anomaly.description());
                case HIGH_RISK_PERMISSION_ADDED -> new RawFinding(FindingType.HIGH_RISK_PERMISSION_ADDED,
                        expectedInstaller ? RiskLevel.LOW : RiskLevel.HIGH,
                        "New high-risk permission", anomaly.description());
                case EXPORTED_SURFACE_INCREASED -> new RawFinding(FindingType.EXPORTED_SURFACE_INCREASED,
                        anomaly.severity().toRiskLevel(),
                        "Exported surface grew", anomaly.description());
                case VERSION_CHANGED, PERMISSION_SET_CHANGED -> null;
            };
            if (finding != null) findings.add(finding);
        }
        return findings;
    }

    /**
     * Android refuses an update signed by another key, so a reinstall from a sideload source with
     * the same certificate stays LOW and the verdict chain weighs it against the app's capabilities.
     * A certificate change is reported on its own. An installer that cannot be identified at all
     * stays MEDIUM.
     */
    private static RawFinding installerChangeFinding(BaselineAnomaly anomaly, TrustEvidence trust) {
        return switch (trust.installerType()) {
            case SIDELOADED -> new RawFinding(FindingType.INSTALLER_ANOMALY, RiskLevel.LOW,
                    "Installer changed to a sideload source", anomaly.description());
            case UNKNOWN -> new RawFinding(FindingType.INSTALLER_ANOMALY, RiskLevel.MEDIUM,
                    "Installer changed", anomaly.description());
            case PLAY_STORE, SYSTEM_INSTALLER, SAMSUNG_STORE, HUAWEI_APPGALLERY, AMAZON_APPSTORE,
                    MDM_INSTALLER -> new RawFinding(FindingType.INSTALLER_ANOMALY_VERIFIED, RiskLevel.LOW,
                    "Installer changed to a known store", anomaly.description());
        };
    }

    private static boolean isSuspiciousLib(NativeLibFinding lib) {
        if (lib == null) return false;
        if (lib.isSuspicious()) return true;
        if (lib.name() == null) return false;
        String lower = lib.name().toLowerCase(Locale.ROOT);
        return SUSPICIOUS_LIB_MARKERS.stream().anyMatch(lower::contains);
    }
}

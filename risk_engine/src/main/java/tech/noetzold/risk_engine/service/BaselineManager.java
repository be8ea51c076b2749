package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.AndroidPermissions;
import tech.noetzold.risk_engine.model.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.*;

/**
 * Detects drift of a package against its stored baseline row and produces the next row.
 * Storage itself belongs to the caller.
 */
@Slf4j
@Service
public class BaselineManager {

    // EXPORTED_SURFACE_INCREASED thresholds, hand tuned
    static final int SURFACE_FROM_ZERO_HIGH = 2;
    static final double SURFACE_RELATIVE_MEDIUM = 0.5;
    static final int SURFACE_ABSOLUTE_MEDIUM = 5;

    /**
     * @param isFirstScan true when the baseline store held no row for any package when the scan
     *                    session started
     */
    public BaselineComparison compareWithBaseline(ScannedAppEvidence current, BaselineRecord stored,
                                                  boolean isFirstScan) {
        String packageName = current.getPackageName();

        if (stored == null) {
            List<BaselineAnomaly> anomalies = new ArrayList<>();
            if (current.isSystemApp() && !isFirstScan) {
                anomalies.add(new BaselineAnomaly(
                        AnomalyType.NEW_SYSTEM_APP, AnomalySeverity.HIGH,
                        "New system app appeared after the first scan",
                        "path=" + current.getApkPath()));
            }
            return new BaselineComparison(packageName, BaselineStatus.NEW, List.copyOf(anomalies), isFirstScan, 0);
        }

        List<BaselineAnomaly> anomalies = new ArrayList<>();
        String currentCert = current.certOrUnknown();

        if (!Objects.equals(stored.certSha256(), currentCert)) {
            anomalies.add(new BaselineAnomaly(AnomalyType.CERT_CHANGED, AnomalySeverity.CRITICAL,
                    "Signing certificate changed",
                    stored.certSha256() + " -> " + currentCert));
        }

        if (current.getVersionCode() < stored.versionCode()) {
            anomalies.add(new BaselineAnomaly(AnomalyType.VERSION_ROLLBACK, AnomalySeverity.HIGH,
                    "Version code decreased",
                    stored.versionCode() + " -> " + current.getVersionCode()));
        } else if (current.getVersionCode() > stored.versionCode()) {
            anomalies.add(new BaselineAnomaly(AnomalyType.VERSION_CHANGED, AnomalySeverity.LOW,
                    "App updated",
                    stored.versionName() + " -> " + current.getVersionName()));
        }

        if (stored.installerPackage() != null && current.getInstallerPackage() != null
                && !stored.installerPackage().equals(current.getInstallerPackage())) {
            anomalies.add(new BaselineAnomaly(AnomalyType.INSTALLER_CHANGED, AnomalySeverity.MEDIUM,
                    "Installer changed",
                    stored.installerPackage() + " -> " + current.getInstallerPackage()));
        }

        AppPartition oldPartition = AppPartition.fromPath(stored.apkPath());
        AppPartition newPartition = AppPartition.fromPath(current.getApkPath());
        if (oldPartition != AppPartition.UNKNOWN && newPartition != AppPartition.UNKNOWN
                && oldPartition != newPartition) {
            anomalies.add(new BaselineAnomaly(AnomalyType.PARTITION_CHANGED, AnomalySeverity.MEDIUM,
                    "Install partition changed",
                    oldPartition + " -> " + newPartition));
        }

        String newHash = permissionSetHash(current.requestedOrEmpty());
        if (!isBlank(stored.permissionSetHash()) && !isBlank(newHash)
                && !stored.permissionSetHash().equals(newHash)) {
            anomalies.add(new BaselineAnomaly(AnomalyType.PERMISSION_SET_CHANGED, AnomalySeverity.LOW,
                    "Requested permissions changed", null));
        }

        Set<String> storedHighRisk = stored.highRiskPermissions() != null ? stored.highRiskPermissions() : Set.of();
        List<String> added = highRiskPermissions(current).stream()
                .filter(p -> !storedHighRisk.contains(p))
                .sorted()
                .toList();
        if (!added.isEmpty()) {
            anomalies.add(new BaselineAnomaly(AnomalyType.HIGH_RISK_PERMISSION_ADDED, AnomalySeverity.HIGH,
                    "High-risk permission added",
                    String.join(",", added)));
        }

        int oldSurface = stored.unprotectedExportedCount();
        int newSurface = current.getUnprotectedExportedCount();
        AnomalySeverity surfaceSeverity = exportedSurfaceSeverity(oldSurface, newSurface);
        if (surfaceSeverity != null) {
            anomalies.add(new BaselineAnomaly(AnomalyType.EXPORTED_SURFACE_INCREASED, surfaceSeverity,
                    "Unprotected exported components increased",
                    oldSurface + " -> " + newSurface));
        }

        BaselineStatus status = anomalies.isEmpty() ? BaselineStatus.UNCHANGED : BaselineStatus.CHANGED;
        if (status == BaselineStatus.CHANGED) {
            log.debug("Baseline drift for {}: {}", packageName, anomalies.stream().map(BaselineAnomaly::type).toList());
        }
        return new BaselineComparison(packageName, status, List.copyOf(anomalies), isFirstScan, stored.scanCount());
    }

    /**
     * Relative growth decides the severity. Returns null when the surface did not grow.
     */
    static AnomalySeverity exportedSurfaceSeverity(int oldCount, int newCount) {
        int delta = newCount - oldCount;
        if (delta <= 0) return null;
        if (oldCount == 0) {
            return newCount >= SURFACE_FROM_ZERO_HIGH ? AnomalySeverity.HIGH : AnomalySeverity.LOW;
        }
        if ((double) delta / oldCount >= SURFACE_RELATIVE_MEDIUM || delta >= SURFACE_ABSOLUTE_MEDIUM) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    public BaselineRecord updateBaseline(ScannedAppEvidence current, BaselineRecord stored, Instant now) {
        String cert = current.certOrUnknown();
        BaselineRecord.BaselineRecordBuilder builder = stored == null
                ? BaselineRecord.builder()
                        .packageName(current.getPackageName())
                        .firstSeenAt(now)
                        .scanCount(1)
                : stored.toBuilder().scanCount(stored.scanCount() + 1);

        if (stored != null && !Objects.equals(stored.certSha256(), cert)) {
            builder.previousCertSha256(stored.certSha256()).lastCertChangeAt(now);
        }

        return builder
                .certSha256(cert)
                .versionCode(current.getVersionCode())
                .versionName(current.getVersionName())
                .isSystemApp(current.isSystemApp())
                .installerPackage(current.getInstallerPackage())
                .apkPath(current.getApkPath())
                .lastSeenAt(now)
                .permissionSetHash(permissionSetHash(current.requestedOrEmpty()))
                .highRiskPermissions(Set.copyOf(highRiskPermissions(current)))
                .exportedActivityCount(current.getExportedActivityCount())
                .exportedServiceCount(current.getExportedServiceCount())
                .exportedReceiverCount(current.getExportedReceiverCount())
                .exportedProviderCount(current.getExportedProviderCount())
                .unprotectedExportedCount(current.getUnprotectedExportedCount())
                .build();
    }

    /**
     * Packages with a stored row that were not observed in the current scan.
     */
    public List<BaselineComparison> findRemovedApps(Collection<BaselineRecord> baselines,
                                                    Set<String> currentPackages) {
        return baselines.stream()
                .filter(b -> !currentPackages.contains(b.packageName()))
                .sorted(Comparator.comparing(BaselineRecord::packageName))
                .map(b -> new BaselineComparison(b.packageName(), BaselineStatus.REMOVED, List.of(),
                        false, b.scanCount()))
                .toList();
    }

    static Set<String> highRiskPermissions(ScannedAppEvidence current) {
        Set<String> result = new TreeSet<>();
        for (String p : current.requestedOrEmpty()) {
            if (AndroidPermissions.isHighRisk(p)) result.add(p);
        }
        for (String p : current.grantedOrEmpty()) {
            if (AndroidPermissions.isHighRisk(p)) result.add(p);
        }
        return result;
    }

    /**
     * MD5 of the sorted permission list, hex encoded. Empty when no permissions are known.
     */
    static String permissionSetHash(List<String> permissions) {
        Set<String> sorted = new TreeSet<>();
        for (String p : permissions) {
            if (p != null && !p.isBlank()) sorted.add(p);
        }
        if (sorted.isEmpty()) return "";
        String joined = String.join(",", sorted);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(joined.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

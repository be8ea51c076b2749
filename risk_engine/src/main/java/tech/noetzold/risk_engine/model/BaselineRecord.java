package tech.noetzold.risk_engine.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Last known state of one package. Field names are read back by the drift comparison, so
 * renaming any of them breaks compatibility with stored rows.
 */
@Builder(toBuilder = true)
public record BaselineRecord(
        String packageName,
        String certSha256,
        String previousCertSha256,
        long versionCode,
        String versionName,
        boolean isSystemApp,
        String installerPackage,
        String apkPath,
        Instant firstSeenAt,
        Instant lastSeenAt,
        Instant lastCertChangeAt,
        int scanCount,
        String permissionSetHash,
        Set<String> highRiskPermissions,
        int exportedActivityCount,
        int exportedServiceCount,
        int exportedReceiverCount,
        int exportedProviderCount,
        int unprotectedExportedCount
) {}

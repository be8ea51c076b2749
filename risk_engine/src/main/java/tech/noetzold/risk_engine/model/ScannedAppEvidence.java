package tech.noetzold.risk_engine.model;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Per-package observation handed over by the package scanner. Every field except the
 * package name may be absent; consumers fall back to a neutral value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ScannedAppEvidence {
    @NotBlank
    private String packageName;
    private String appName;
    private String certSha256;
    private long versionCode;
    private String versionName;

    private boolean systemApp;
    private boolean privilegedApp;
    private boolean updatedSystemApp;
    private boolean platformSigned;
    private String installerPackage;
    private String apkPath;
    private AppPartition partition;

    private List<String> requestedPermissions;
    private List<String> grantedPermissions;

    private int exportedActivityCount;
    private int exportedServiceCount;
    private int exportedReceiverCount;
    private int exportedProviderCount;
    private int unprotectedExportedCount;

    private List<NativeLibFinding> nativeLibFindings;
    private int targetSdk;
    private int minSdk;
    private long apkSizeBytes;
    private boolean debugSigned;

    private boolean lineagePresent;
    private int lineageLength;
    private boolean lineageTrusted;

    private Instant lastUpdateAt;

    /**
     * Granted permissions without null or blank entries.
     */
    public List<String> grantedOrEmpty() {
        return namesOrEmpty(grantedPermissions);
    }

    public List<String> requestedOrEmpty() {
        return namesOrEmpty(requestedPermissions);
    }

    public List<NativeLibFinding> nativeLibsOrEmpty() {
        if (nativeLibFindings == null) return List.of();
        return nativeLibFindings.stream().filter(Objects::nonNull).toList();
    }

    private static List<String> namesOrEmpty(List<String> names) {
        if (names == null) return List.of();
        return names.stream()
                .filter(n -> n != null && !n.isBlank())
                .toList();
    }

    public AppPartition resolvedPartition() {
        if (partition != null && partition != AppPartition.UNKNOWN) return partition;
        return AppPartition.fromPath(apkPath);
    }

    public String certOrUnknown() {
        return (certSha256 == null || certSha256.isBlank()) ? "UNKNOWN" : certSha256;
    }
}

package tech.noetzold.risk_engine.catalog;

import tech.noetzold.risk_engine.model.AppPartition;
import tech.noetzold.risk_engine.model.TrustDomain;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known developer signing certificates and per-app certificate pins. Built once from
 * configuration, read-only.
 */
public class TrustedAppsCatalog {

    public record DeveloperEntry(
            String developerName,
            Set<String> certDigests,
            Set<String> packagePrefixes,
            TrustDomain domain
    ) {
        public boolean coversPackage(String packageName) {
            return packagePrefixes.stream().anyMatch(packageName::startsWith);
        }
    }

    private final List<DeveloperEntry> developers;
    private final Map<String, Set<String>> verifiedApps;

    public TrustedAppsCatalog(List<DeveloperEntry> developers, Map<String, Set<String>> verifiedApps) {
        this.developers = List.copyOf(developers);
        this.verifiedApps = Map.copyOf(verifiedApps);
    }

    /**
     * A catalog that knows no signer, so every certificate check ends in UNKNOWN.
     */
    public TrustedAppsCatalog() {
        this(List.of(), Map.of());
    }

    public Optional<Set<String>> verifiedCertsFor(String packageName) {
        if (packageName == null) return Optional.empty();
        return Optional.ofNullable(verifiedApps.get(packageName));
    }

    public Optional<DeveloperEntry> developerFor(String packageName) {
        if (packageName == null) return Optional.empty();
        return developers.stream().filter(d -> d.coversPackage(packageName)).findFirst();
    }

    public TrustDomain classifySignerDomain(AppPartition partition, boolean isPlatformSigned,
                                            String apkPath, boolean isSystemApp) {
        if (apkPath != null && apkPath.startsWith("/apex/")) return TrustDomain.APEX_MODULE;
        if (isPlatformSigned) return TrustDomain.PLATFORM_SIGNED;
        if (isSystemApp) {
            if (partition == AppPartition.VENDOR || partition == AppPartition.PRODUCT) {
                return TrustDomain.OEM_VENDOR;
            }
            return TrustDomain.PLATFORM_SIGNED;
        }
        if (partition == AppPartition.UNKNOWN && (apkPath == null || apkPath.isBlank())) {
            return TrustDomain.UNKNOWN;
        }
        return TrustDomain.PLAY_SIGNED;
    }

    /**
     * A non-updated system app executing from the data partition.
     */
    public boolean detectPartitionAnomaly(boolean isSystemApp, boolean isUpdatedSystemApp,
                                          AppPartition partition, String apkPath) {
        if (!isSystemApp || isUpdatedSystemApp) return false;
        return partition == AppPartition.DATA || (apkPath != null && apkPath.startsWith("/data/app"));
    }
}

package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.TrustedAppsCatalog;
import tech.noetzold.risk_engine.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scores identity and provenance of a package. Pure function of the scanned evidence and the
 * device integrity fact read once per scan session.
 */
@Slf4j
@Service
public class TrustEvidenceEngine {

    static final int WEIGHT_SYSTEM_APP = 15;
    static final int WEIGHT_PLATFORM_SIGNED = 15;
    static final int WEIGHT_CERT_MATCH = 30;
    static final int WEIGHT_CERT_MISMATCH = -20;
    static final int WEIGHT_EXPECTED_INSTALLER = 20;
    static final int WEIGHT_SIDELOADED = -5;
    static final int WEIGHT_TRUSTED_LINEAGE = 10;
    static final int WEIGHT_BOOT_GREEN = 10;
    static final int WEIGHT_BOOT_BROKEN = -10;
    static final int WEIGHT_ROOTED = -15;

    private static final int CERT_PREFIX_LENGTH = 40;

    private static final Map<String, InstallerType> KNOWN_INSTALLERS = Map.of(
            "com.android.vending", InstallerType.PLAY_STORE,
            "com.google.android.packageinstaller", InstallerType.SYSTEM_INSTALLER,
            "com.android.packageinstaller", InstallerType.SYSTEM_INSTALLER,
            "com.sec.android.app.samsungapps", InstallerType.SAMSUNG_STORE,
            "com.samsung.android.scloud", InstallerType.SAMSUNG_STORE,
            "com.huawei.appmarket", InstallerType.HUAWEI_APPGALLERY,
            "com.amazon.venezia", InstallerType.AMAZON_APPSTORE
    );

    private final TrustedAppsCatalog catalog;

    public TrustEvidenceEngine(TrustedAppsCatalog catalog) {
        this.catalog = catalog;
    }

    public TrustEvidence collectEvidence(ScannedAppEvidence app, DeviceIntegrityEvidence integrity) {
        String packageName = app.getPackageName();
        String cert = app.certOrUnknown();
        DeviceIntegrityEvidence device = integrity != null ? integrity : DeviceIntegrityEvidence.unknown();

        AppPartition partition = app.resolvedPartition();
        TrustDomain domain = catalog.classifySignerDomain(
                partition, app.isPlatformSigned(), app.getApkPath(), app.isSystemApp());
        SystemAppInfo systemInfo = new SystemAppInfo(
                app.isSystemApp(), app.isPrivilegedApp(), app.isUpdatedSystemApp(),
                partition, app.isPlatformSigned(), domain);

        CertMatchResult certMatch = verifyCertificate(packageName, cert, domain);
        InstallerInfo installer = classifyInstaller(app.getInstallerPackage());
        SigningLineageInfo lineage = new SigningLineageInfo(
                app.isLineagePresent(), app.getLineageLength(), app.isLineageTrusted());

        List<TrustReason> reasons = new ArrayList<>();
        int score = 0;

        if (systemInfo.isSystemApp()) {
            score += reason(reasons, "System app (" + partition + ")", WEIGHT_SYSTEM_APP);
        }
        if (systemInfo.isPlatformSigned()) {
            score += reason(reasons, "Signed with the platform key", WEIGHT_PLATFORM_SIGNED);
        }

        switch (certMatch.matchType()) {
            case DEVELOPER_MATCH -> score += reason(reasons,
                    "Certificate matches developer " + certMatch.matchedDeveloper(), WEIGHT_CERT_MATCH);
            case APP_MATCH -> score += reason(reasons, "Certificate matches pinned app certificate", WEIGHT_CERT_MATCH);
            case CERT_MISMATCH -> score += reason(reasons, "Certificate does not match the known signer", WEIGHT_CERT_MISMATCH);
            case UNKNOWN -> { }
        }

        if (installer.isExpectedInstaller()) {
            score += reason(reasons, "Installed from " + installer.installerType(), WEIGHT_EXPECTED_INSTALLER);
        } else if (installer.installerType() == InstallerType.SIDELOADED) {
            score += reason(reasons, "Sideloaded by " + installer.installerPackage(), WEIGHT_SIDELOADED);
        }

        if (lineage.hasLineage() && lineage.lineageTrusted()) {
            score += reason(reasons, "Trusted signing key rotation lineage", WEIGHT_TRUSTED_LINEAGE);
        }

        switch (device.verifiedBootState() != null ? device.verifiedBootState() : VerifiedBootState.UNKNOWN) {
            case GREEN -> score += reason(reasons, "Verified boot GREEN", WEIGHT_BOOT_GREEN);
            case ORANGE, RED -> score += reason(reasons,
                    "Verified boot " + device.verifiedBootState(), WEIGHT_BOOT_BROKEN);
            case YELLOW, UNKNOWN -> { }
        }

        if (device.isRooted()) {
            score += reason(reasons, "Device is rooted", WEIGHT_ROOTED);
        }

        int clamped = Math.max(0, Math.min(100, score));
        TrustLevel level = determineLevel(clamped, certMatch, systemInfo, device);

        log.debug("Trust for {}: score={} level={} cert={} installer={}",
                packageName, clamped, level, certMatch.matchType(), installer.installerType());

        return new TrustEvidence(packageName, cert, certMatch, installer, systemInfo, lineage,
                device, clamped, level, List.copyOf(reasons));
    }

    public InstallerInfo classifyInstaller(String installerPackage) {
        InstallerType type = classifyInstallerType(installerPackage);
        return new InstallerInfo(installerPackage, type, type.isExpected());
    }

    public static InstallerType classifyInstallerType(String installerPackage) {
        if (installerPackage == null || installerPackage.isBlank()) return InstallerType.UNKNOWN;
        InstallerType known = KNOWN_INSTALLERS.get(installerPackage);
        if (known != null) return known;
        String lower = installerPackage.toLowerCase(Locale.ROOT);
        if (lower.contains("mdm") || lower.contains("enterprise")) return InstallerType.MDM_INSTALLER;
        return InstallerType.SIDELOADED;
    }

    /**
     * Whitelist comparison. A mismatch is only reported when the package lives in the same
     * signing domain as the whitelist entry; otherwise the result is UNKNOWN.
     */
    public CertMatchResult verifyCertificate(String packageName, String certSha256, TrustDomain domain) {
        if (certSha256 == null || "UNKNOWN".equals(certSha256) || packageName == null) {
            return CertMatchResult.unknown(certSha256);
        }
        String prefix = normalize(certSha256);

        Optional<Set<String>> pinned = catalog.verifiedCertsFor(packageName);
        if (pinned.isPresent()) {
            if (domain != TrustDomain.PLAY_SIGNED) return CertMatchResult.unknown(certSha256);
            boolean matches = pinned.get().stream().anyMatch(p -> prefixesMatch(prefix, normalize(p)));
            return new CertMatchResult(matches ? CertMatchType.APP_MATCH : CertMatchType.CERT_MISMATCH,
                    null, certSha256);
        }

        Optional<TrustedAppsCatalog.DeveloperEntry> developer = catalog.developerFor(packageName);
        if (developer.isPresent()) {
            TrustedAppsCatalog.DeveloperEntry entry = developer.get();
            if (entry.domain() != domain) return CertMatchResult.unknown(certSha256);
            boolean matches = entry.certDigests().stream().anyMatch(d -> prefixesMatch(prefix, normalize(d)));
            return new CertMatchResult(matches ? CertMatchType.DEVELOPER_MATCH : CertMatchType.CERT_MISMATCH,
                    entry.developerName(), certSha256);
        }

        return CertMatchResult.unknown(certSha256);
    }

    TrustLevel determineLevel(int score, CertMatchResult certMatch, SystemAppInfo systemInfo,
                              DeviceIntegrityEvidence device) {
        if (certMatch.matchType() == CertMatchType.CERT_MISMATCH) return TrustLevel.ANOMALOUS;
        if (device.isRooted() && systemInfo.isSystemApp() && !systemInfo.isPlatformSigned()) {
            return TrustLevel.ANOMALOUS;
        }
        return TrustLevel.fromScore(score);
    }

    private static int reason(List<TrustReason> reasons, String evidence, int contribution) {
        reasons.add(new TrustReason(evidence, contribution, contribution > 0));
        return contribution;
    }

    private static String normalize(String digest) {
        String clean = digest.replace(":", "").trim().toUpperCase(Locale.ROOT);
        return clean.length() > CERT_PREFIX_LENGTH ? clean.substring(0, CERT_PREFIX_LENGTH) : clean;
    }

    private static boolean prefixesMatch(String a, String b) {
        return a.startsWith(b) || b.startsWith(a);
    }
}

package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.catalog.TrustedAppsCatalog;
import tech.noetzold.risk_engine.model.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TrustEvidenceEngineTest {

    private static final String GOOGLE_CERT = "38:91:8A:45:3D:07:19:93:54:F8:B1:9A:F0:5E:C6:56:2C:ED:57:88";
    private static final DeviceIntegrityEvidence GREEN = new DeviceIntegrityEvidence(false, VerifiedBootState.GREEN);

    private static final String BANK_CERT = "5A1F0C9E4D2B7A8C3E6F1D0B9A8C7E6F5D4C3B2A1F0E9D8C7B6A5F4E3D2C1B0A";

    static final TrustedAppsCatalog CATALOG = new TrustedAppsCatalog(
            List.of(new TrustedAppsCatalog.DeveloperEntry("Google",
                    Set.of("38918A453D07199354F8B19AF05EC6562CED5788"),
                    Set.of("com.google."),
                    TrustDomain.PLAY_SIGNED)),
            Map.of("cz.example.bank", Set.of(BANK_CERT)));

    private final TrustEvidenceEngine engine = new TrustEvidenceEngine(CATALOG);

    @Test
    void developerCertificateFromStoreIsModerateTrust() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.google.android.gm")
                .certSha256(GOOGLE_CERT)
                .installerPackage("com.android.vending")
                .apkPath("/data/app/com.google.android.gm-1/base.apk")
                .build();

        TrustEvidence trust = engine.collectEvidence(app, GREEN);

        assertEquals(CertMatchType.DEVELOPER_MATCH, trust.certMatch().matchType());
        assertEquals("Google", trust.certMatch().matchedDeveloper());
        assertEquals(InstallerType.PLAY_STORE, trust.installerType());
        assertEquals(60, trust.trustScore());
        assertEquals(TrustLevel.MODERATE, trust.trustLevel());
        assertEquals(3, trust.reasons().size());
    }

    @Test
    void certificateMismatchIsAnomalousRegardlessOfScore() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.google.android.gm")
                .certSha256("DEADBEEFDEADBEEFDEADBEEFDEADBEEFDEADBEEF")
                .installerPackage("com.android.vending")
                .apkPath("/data/app/com.google.android.gm-1/base.apk")
                .build();

        TrustEvidence trust = engine.collectEvidence(app, GREEN);

        assertEquals(CertMatchType.CERT_MISMATCH, trust.certMatch().matchType());
        assertEquals(10, trust.trustScore());
        assertEquals(TrustLevel.ANOMALOUS, trust.trustLevel());
    }

    @Test
    void mismatchOutsideTheDevelopersSigningDomainIsUnknown() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.google.android.modulemetadata")
                .certSha256("DEADBEEFDEADBEEFDEADBEEFDEADBEEFDEADBEEF")
                .apkPath("/apex/com.android.modulemetadata/app.apk")
                .build();

        TrustEvidence trust = engine.collectEvidence(app, null);

        assertEquals(TrustDomain.APEX_MODULE, trust.systemAppInfo().trustDomain());
        assertEquals(CertMatchType.UNKNOWN, trust.certMatch().matchType());
        assertNotEquals(TrustLevel.ANOMALOUS, trust.trustLevel());
    }

    @Test
    void sideloadedUnknownAppIsClampedAtZero() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.example.flashlight")
                .installerPackage("com.some.browser")
                .build();

        TrustEvidence trust = engine.collectEvidence(app, null);

        assertEquals(InstallerType.SIDELOADED, trust.installerType());
        assertTrue(trust.isSideloaded());
        assertEquals(0, trust.trustScore());
        assertEquals(TrustLevel.LOW, trust.trustLevel());
        assertEquals("UNKNOWN", trust.certSha256());
    }

    @Test
    void rootedDeviceWithNonPlatformSignedSystemAppIsAnomalous() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.vendor.updater")
                .systemApp(true)
                .apkPath("/system/app/Updater/Updater.apk")
                .build();

        TrustEvidence trust = engine.collectEvidence(app, new DeviceIntegrityEvidence(true, VerifiedBootState.ORANGE));

        assertEquals(TrustLevel.ANOMALOUS, trust.trustLevel());
        assertEquals(0, trust.trustScore());
    }

    @Test
    void platformSignedSystemAppWithTrustedLineageIsHighTrust() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.android.settings")
                .systemApp(true)
                .platformSigned(true)
                .installerPackage("com.android.packageinstaller")
                .apkPath("/system/priv-app/Settings/Settings.apk")
                .lineagePresent(true)
                .lineageLength(2)
                .lineageTrusted(true)
                .build();

        TrustEvidence trust = engine.collectEvidence(app, GREEN);

        assertEquals(TrustDomain.PLATFORM_SIGNED, trust.systemAppInfo().trustDomain());
        assertEquals(70, trust.trustScore());
        assertEquals(TrustLevel.HIGH, trust.trustLevel());
    }

    @Test
    void trustScoreStaysWithinBoundsForEveryEvidenceCombination() {
        List<DeviceIntegrityEvidence> devices = List.of(
                GREEN,
                new DeviceIntegrityEvidence(true, VerifiedBootState.RED),
                DeviceIntegrityEvidence.unknown());
        List<String> installers = List.of("com.android.vending", "com.random.app", "");
        for (boolean system : new boolean[]{true, false}) {
            for (boolean platform : new boolean[]{true, false}) {
                for (boolean lineage : new boolean[]{true, false}) {
                    for (String installer : installers) {
                        for (DeviceIntegrityEvidence device : devices) {
                            ScannedAppEvidence app = ScannedAppEvidence.builder()
                                    .packageName("com.google.android.apps.maps")
                                    .certSha256(GOOGLE_CERT)
                                    .systemApp(system)
                                    .platformSigned(platform)
                                    .lineagePresent(lineage)
                                    .lineageTrusted(lineage)
                                    .installerPackage(installer)
                                    .apkPath("/data/app/maps/base.apk")
                                    .build();
                            int score = engine.collectEvidence(app, device).trustScore();
                            assertTrue(score >= 0 && score <= 100, "score out of range: " + score);
                        }
                    }
                }
            }
        }
    }

    @Test
    void pinnedAppIsMatchedOnItsOwnCertificate() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("cz.example.bank")
                .certSha256(BANK_CERT)
                .installerPackage("com.android.vending")
                .apkPath("/data/app/cz.example.bank-1/base.apk")
                .build();

        assertEquals(CertMatchType.APP_MATCH, engine.collectEvidence(app, GREEN).certMatch().matchType());
        assertEquals(CertMatchType.CERT_MISMATCH, engine.collectEvidence(
                app.toBuilder().certSha256("0000" + BANK_CERT.substring(4)).build(), GREEN).certMatch().matchType());
    }

    @Test
    void unconfiguredCatalogNeverReportsAMismatch() {
        TrustEvidenceEngine bare = new TrustEvidenceEngine(new TrustedAppsCatalog());
        for (String pkg : List.of("com.facebook.katana", "com.google.android.gm", "cz.airbank.android")) {
            ScannedAppEvidence app = ScannedAppEvidence.builder()
                    .packageName(pkg)
                    .certSha256("DEADBEEFDEADBEEFDEADBEEFDEADBEEFDEADBEEF")
                    .installerPackage("com.android.vending")
                    .apkPath("/data/app/" + pkg + "-1/base.apk")
                    .build();

            TrustEvidence trust = bare.collectEvidence(app, GREEN);

            assertEquals(CertMatchType.UNKNOWN, trust.certMatch().matchType(), pkg);
            assertNotEquals(TrustLevel.ANOMALOUS, trust.trustLevel(), pkg);
        }
    }

    @Test
    void installerPackagesAreClassified() {
        assertEquals(InstallerType.UNKNOWN, TrustEvidenceEngine.classifyInstallerType(null));
        assertEquals(InstallerType.UNKNOWN, TrustEvidenceEngine.classifyInstallerType(" "));
        assertEquals(InstallerType.PLAY_STORE, TrustEvidenceEngine.classifyInstallerType("com.android.vending"));
        assertEquals(InstallerType.SAMSUNG_STORE,
                TrustEvidenceEngine.classifyInstallerType("com.sec.android.app.samsungapps"));
        assertEquals(InstallerType.MDM_INSTALLER, TrustEvidenceEngine.classifyInstallerType("com.acme.mdm.agent"));
        assertEquals(InstallerType.SIDELOADED, TrustEvidenceEngine.classifyInstallerType("org.mozilla.firefox"));
    }
}

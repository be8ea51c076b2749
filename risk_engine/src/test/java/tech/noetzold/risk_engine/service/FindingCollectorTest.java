package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.catalog.AndroidPermissions;
import tech.noetzold.risk_engine.catalog.CategoryWhitelist;
import tech.noetzold.risk_engine.catalog.TrustedAppsCatalog;
import tech.noetzold.risk_engine.model.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static tech.noetzold.risk_engine.service.TrustRiskModelTest.trust;

class FindingCollectorTest {

    private final FindingCollector collector = new FindingCollector(new TrustedAppsCatalog(), new CategoryWhitelist());

    private static List<FindingType> types(List<RawFinding> findings) {
        return findings.stream().map(RawFinding::type).toList();
    }

    private static RawFinding find(List<RawFinding> findings, FindingType type) {
        return findings.stream().filter(f -> f.type() == type).findFirst().orElseThrow();
    }

    @Test
    void sideloadedDebugBuildCollectsEveryStaticFinding() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.free.cleaner")
                .debugSigned(true)
                .nativeLibFindings(List.of(
                        new NativeLibFinding("libc++_shared.so", false, null),
                        new NativeLibFinding("libfrida-gadget.so", false, null)))
                .targetSdk(25)
                .unprotectedExportedCount(2)
                .grantedPermissions(List.of(
                        AndroidPermissions.READ_SMS, AndroidPermissions.SEND_SMS, AndroidPermissions.RECEIVE_SMS,
                        AndroidPermissions.READ_CALL_LOG, AndroidPermissions.SYSTEM_ALERT_WINDOW,
                        AndroidPermissions.REQUEST_INSTALL_PACKAGES))
                .build();
        Set<CapabilityCluster> active = EnumSet.of(CapabilityCluster.SMS, CapabilityCluster.CALL_LOG,
                CapabilityCluster.OVERLAY, CapabilityCluster.INSTALL_PACKAGES);

        List<RawFinding> findings = collector.staticFindings(app, trust(10, InstallerType.SIDELOADED),
                AppCategory.OTHER, active);

        assertEquals(List.of(
                FindingType.DEBUG_SIGNATURE,
                FindingType.SUSPICIOUS_NATIVE_LIB,
                FindingType.OLD_TARGET_SDK,
                FindingType.EXPORTED_COMPONENTS,
                FindingType.OVER_PRIVILEGED,
                FindingType.NOT_PLAY_SIGNED,
                FindingType.HIGH_RISK_CAPABILITY,
                FindingType.HIGH_RISK_CAPABILITY,
                FindingType.HIGH_RISK_CAPABILITY,
                FindingType.HIGH_RISK_CAPABILITY), types(findings));
        assertEquals(RiskLevel.MEDIUM, find(findings, FindingType.OLD_TARGET_SDK).severity());
        assertTrue(find(findings, FindingType.SUSPICIOUS_NATIVE_LIB).description().contains("libfrida-gadget.so"));
        assertFalse(find(findings, FindingType.SUSPICIOUS_NATIVE_LIB).description().contains("libc++_shared.so"));
    }

    @Test
    void cleanStoreAppHasNoFindings() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.example.bank")
                .targetSdk(34)
                .grantedPermissions(List.of(AndroidPermissions.CAMERA))
                .build();

        assertTrue(collector.staticFindings(app, trust(60, InstallerType.PLAY_STORE),
                AppCategory.BANKING, EnumSet.noneOf(CapabilityCluster.class)).isEmpty());
    }

    @Test
    void whitelistedClusterIsNotACapabilityFinding() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.wireguard.android")
                .targetSdk(33)
                .build();

        List<RawFinding> findings = collector.staticFindings(app, trust(60, InstallerType.PLAY_STORE),
                AppCategory.VPN, EnumSet.of(CapabilityCluster.VPN));

        assertTrue(findings.isEmpty());
    }

    @Test
    void systemAppOnDataPartitionIsPartitionAnomaly() {
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.android.vendorservice")
                .systemApp(true)
                .apkPath("/data/app/com.android.vendorservice-1/base.apk")
                .targetSdk(33)
                .build();

        List<RawFinding> findings = collector.staticFindings(app, trust(15, InstallerType.UNKNOWN),
                AppCategory.OTHER, EnumSet.noneOf(CapabilityCluster.class));

        assertEquals(List.of(FindingType.PARTITION_ANOMALY), types(findings));
        assertEquals(RiskLevel.HIGH, findings.get(0).severity());
    }

    @Test
    void baselineAnomaliesAreHardWhenTheInstallerIsNotTrusted() {
        BaselineComparison comparison = new BaselineComparison("com.example.app", BaselineStatus.CHANGED, List.of(
                new BaselineAnomaly(AnomalyType.INSTALLER_CHANGED, AnomalySeverity.MEDIUM, "Installer changed", null),
                new BaselineAnomaly(AnomalyType.HIGH_RISK_PERMISSION_ADDED, AnomalySeverity.HIGH, "Added", null),
                new BaselineAnomaly(AnomalyType.VERSION_CHANGED, AnomalySeverity.LOW, "Updated", null),
                new BaselineAnomaly(AnomalyType.PERMISSION_SET_CHANGED, AnomalySeverity.LOW, "Changed", null),
                new BaselineAnomaly(AnomalyType.EXPORTED_SURFACE_INCREASED, AnomalySeverity.MEDIUM, "Grew", null)),
                false, 3);

        List<RawFinding> sideloaded = collector.baselineFindings(comparison, trust(10, InstallerType.SIDELOADED), false);
        assertEquals(List.of(FindingType.INSTALLER_ANOMALY, FindingType.HIGH_RISK_PERMISSION_ADDED,
                FindingType.EXPORTED_SURFACE_INCREASED), types(sideloaded));
        assertEquals(RiskLevel.LOW, sideloaded.get(0).severity());
        assertEquals(Hardness.HARD, sideloaded.get(0).hardness());
        assertEquals(RiskLevel.HIGH, sideloaded.get(1).severity());
        assertEquals(RiskLevel.MEDIUM, sideloaded.get(2).severity());

        List<RawFinding> fromStore = collector.baselineFindings(comparison, trust(60, InstallerType.PLAY_STORE), false);
        assertEquals(FindingType.INSTALLER_ANOMALY_VERIFIED, fromStore.get(0).type());
        assertEquals(Hardness.SOFT, fromStore.get(0).hardness());
        assertEquals(RiskLevel.LOW, fromStore.get(1).severity());
    }

    @Test
    void installerChangeToUnidentifiedSourceStaysMedium() {
        BaselineComparison comparison = new BaselineComparison("com.example.app", BaselineStatus.CHANGED, List.of(
                new BaselineAnomaly(AnomalyType.INSTALLER_CHANGED, AnomalySeverity.MEDIUM, "Installer changed",
                        "com.android.vending -> com.unknown.shell")),
                false, 2);

        List<RawFinding> findings = collector.baselineFindings(comparison, trust(30, InstallerType.UNKNOWN), false);

        assertEquals(List.of(FindingType.INSTALLER_ANOMALY), types(findings));
        assertEquals(RiskLevel.MEDIUM, findings.get(0).severity());
    }

    @Test
    void nullNativeLibEntriesAreIgnored() {
        List<NativeLibFinding> libs = new ArrayList<>();
        libs.add(null);
        libs.add(new NativeLibFinding(null, false, null));
        libs.add(new NativeLibFinding("libxposed_art.so", false, null));
        ScannedAppEvidence app = ScannedAppEvidence.builder()
                .packageName("com.example.hooked")
                .targetSdk(34)
                .nativeLibFindings(libs)
                .build();

        List<RawFinding> findings = collector.staticFindings(app, trust(60, InstallerType.PLAY_STORE),
                AppCategory.OTHER, EnumSet.noneOf(CapabilityCluster.class));

        assertEquals(List.of(FindingType.SUSPICIOUS_NATIVE_LIB), types(findings));
        assertTrue(findings.get(0).description().endsWith("libxposed_art.so"));
    }

    @Test
    void partitionMoveOfSystemAppIsLowSeverity() {
        BaselineComparison comparison = new BaselineComparison("com.android.app", BaselineStatus.CHANGED, List.of(
                new BaselineAnomaly(AnomalyType.PARTITION_CHANGED, AnomalySeverity.MEDIUM, "Moved", "SYSTEM -> PRODUCT")),
                false, 5);

        assertEquals(RiskLevel.LOW,
                collector.baselineFindings(comparison, trust(50, InstallerType.UNKNOWN), true).get(0).severity());
        assertEquals(RiskLevel.MEDIUM,
                collector.baselineFindings(comparison, trust(50, InstallerType.UNKNOWN), false).get(0).severity());
    }
}

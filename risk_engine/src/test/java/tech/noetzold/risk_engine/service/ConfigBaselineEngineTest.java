package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.model.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigBaselineEngineTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");
    private static final String CA = "AB12CD34EF56AB12CD34EF56AB12CD34EF56AB12";

    private final ConfigBaselineEngine engine = new ConfigBaselineEngine();

    private static ConfigSnapshot.ConfigSnapshotBuilder baseline() {
        return ConfigSnapshot.builder()
                .timestamp(NOW)
                .privateDnsMode("opportunistic")
                .defaultSmsApp("com.google.android.apps.messaging")
                .defaultDialerApp("com.google.android.dialer")
                .enabledAccessibilityServices(Set.of("com.google.android.marvin.talkback"));
    }

    private static List<ConfigChangeType> types(ConfigDelta delta) {
        return delta.changes().stream().map(ConfigChange::type).toList();
    }

    @Test
    void missingPreviousSnapshotYieldsEmptyDelta() {
        ConfigDelta delta = engine.compareSnapshots(null, baseline().build());

        assertFalse(delta.hasChanges());
        assertNull(delta.oldHash());
        assertNotNull(delta.newHash());
    }

    @Test
    void identicalSnapshotsHaveNoChanges() {
        ConfigSnapshot a = baseline().userCaCertFingerprints(Set.of("x", "y")).build();
        ConfigSnapshot b = baseline().userCaCertFingerprints(Set.of("y", "x")).timestamp(NOW.plusSeconds(60)).build();

        ConfigDelta delta = engine.compareSnapshots(a, b);

        assertFalse(delta.hasChanges());
        assertEquals(a.configHash(), b.configHash());
        assertEquals(SignalSeverity.INFO, delta.maxSeverity());
    }

    @Test
    void nullAndBlankEntriesInSnapshotSetsAreIgnored() {
        Set<String> certs = new HashSet<>(Arrays.asList(CA, null, " "));
        Set<String> services = new HashSet<>(Arrays.asList("com.google.android.marvin.talkback", null));
        ConfigSnapshot messy = baseline()
                .userCaCertFingerprints(certs)
                .enabledAccessibilityServices(services)
                .build();

        ConfigDelta delta = assertDoesNotThrow(() -> engine.compareSnapshots(baseline().build(), messy));

        assertEquals(List.of(ConfigChangeType.CA_CERT_ADDED), types(delta));
        assertEquals(baseline().userCaCertFingerprints(Set.of(CA)).build().configHash(), messy.configHash());
    }

    @Test
    void interceptionSetupIsDetected() {
        ConfigSnapshot after = baseline()
                .userCaCertFingerprints(Set.of(CA))
                .vpnActive(true).vpnPackage("com.unknown.vpn")
                .globalProxyHost("10.0.0.5").globalProxyPort("8080")
                .build();

        ConfigDelta delta = engine.compareSnapshots(baseline().build(), after);

        assertEquals(List.of(ConfigChangeType.CA_CERT_ADDED, ConfigChangeType.VPN_ENABLED,
                ConfigChangeType.PROXY_ENABLED), types(delta));
        assertEquals("AB12CD34EF56AB12...", delta.changes().get(0).newValue());
        assertEquals("10.0.0.5:8080", delta.changes().get(2).newValue());
        assertEquals(SignalSeverity.HIGH, delta.maxSeverity());
    }

    @Test
    void specialAccessAndDefaultAppChangesAreDetected() {
        ConfigSnapshot after = baseline()
                .enabledAccessibilityServices(Set.of("com.spy.tracker/.Svc"))
                .enabledNotificationListeners(Set.of("com.spy.tracker/.Listener"))
                .defaultSmsApp("com.spy.tracker")
                .build();

        ConfigDelta delta = engine.compareSnapshots(baseline().build(), after);

        assertEquals(List.of(
                ConfigChangeType.ACCESSIBILITY_SERVICE_ADDED,
                ConfigChangeType.ACCESSIBILITY_SERVICE_REMOVED,
                ConfigChangeType.NOTIFICATION_LISTENER_ADDED,
                ConfigChangeType.DEFAULT_SMS_CHANGED), types(delta));
        assertEquals("com.spy.tracker", delta.changes().get(3).relatedPackage());
    }

    @Test
    void hardeningTogglesAreOnlyReportedWhenSwitchedOn() {
        ConfigSnapshot relaxed = baseline().developerOptionsEnabled(true).usbDebuggingEnabled(true)
                .unknownSourcesEnabled(true).build();

        ConfigDelta on = engine.compareSnapshots(baseline().build(), relaxed);
        ConfigDelta off = engine.compareSnapshots(relaxed, baseline().build());

        assertEquals(List.of(ConfigChangeType.DEVELOPER_OPTIONS_ENABLED, ConfigChangeType.USB_DEBUGGING_ENABLED,
                ConfigChangeType.UNKNOWN_SOURCES_ENABLED), types(on));
        assertFalse(off.hasChanges());
        assertNotEquals(off.oldHash(), off.newHash());
    }

    @Test
    void changesBecomeDeterministicSignals() {
        ConfigSnapshot after = baseline().userCaCertFingerprints(Set.of(CA)).privateDnsMode("off").build();
        ConfigDelta delta = engine.compareSnapshots(baseline().build(), after);

        List<SecuritySignal> signals = engine.changesToSignals(delta, NOW);
        List<SecuritySignal> again = engine.changesToSignals(delta, NOW);

        assertEquals(2, signals.size());
        assertEquals(signals, again);
        assertEquals(SignalType.USER_CA_CERT_ADDED, signals.get(0).type());
        assertEquals(SignalSource.CONFIG_BASELINE, signals.get(0).source());
        assertEquals(SignalType.PRIVATE_DNS_CHANGED, signals.get(1).type());
        assertEquals("opportunistic:null", signals.get(1).details().get("old"));
        assertEquals("off:null", signals.get(1).details().get("new"));
    }
}

package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.catalog.DangerousComboCatalog;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.repository.impl.InMemoryIncidentRepository;
import tech.noetzold.risk_engine.repository.impl.InMemorySecurityEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");

    private IncidentService incidentService;
    private ConfigMonitorService service;

    @BeforeEach
    void setUp() {
        incidentService = new IncidentService(new InMemoryIncidentRepository());
        service = new ConfigMonitorService(
                new ConfigBaselineEngine(),
                new EventRecorder(new InMemorySecurityEventRepository(), new DangerousComboCatalog(), 30),
                new DefaultRootCauseResolver(),
                incidentService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ConfigSnapshot.ConfigSnapshotBuilder clean() {
        return ConfigSnapshot.builder().timestamp(NOW).privateDnsMode("opportunistic");
    }

    @Test
    void firstSnapshotOnlyBecomesTheReference() {
        ConfigSnapshot snapshot = clean().build();

        ConfigCompareResponse response = service.compare(ConfigCompareRequest.builder().current(snapshot).build());

        assertFalse(response.delta().hasChanges());
        assertTrue(response.incidents().isEmpty());
        assertSame(snapshot, service.lastSnapshot());
    }

    @Test
    void caCertWithVpnAgainstStoredSnapshotOpensInterceptionIncident() {
        service.compare(ConfigCompareRequest.builder().current(clean().build()).build());
        ConfigSnapshot intercepted = clean()
                .userCaCertFingerprints(Set.of("AB12CD34EF56AB12CD34EF56AB12CD34EF56AB12"))
                .vpnActive(true).vpnPackage("com.unknown.vpn")
                .build();

        ConfigCompareResponse response = service.compare(ConfigCompareRequest.builder().current(intercepted).build());

        assertEquals(SignalSeverity.HIGH, response.delta().maxSeverity());
        assertEquals(1, response.incidents().size());
        SecurityIncident incident = response.incidents().get(0);
        assertEquals("Man-in-the-middle interception", incident.title());
        assertEquals(IncidentSeverity.HIGH, incident.severity());
        assertNull(incident.packageName());
        assertEquals(EventType.CA_CERT_INSTALLED, incident.events().get(0).type());
        assertTrue(incident.events().get(0).isPromoted());
        assertEquals(1, incidentService.findByStatus(IncidentStatus.OPEN).size());
        assertSame(intercepted, service.lastSnapshot());
    }

    @Test
    void explicitPreviousSnapshotIsUsedAndCurrentIsRemembered() {
        ConfigSnapshot previous = clean().build();
        ConfigSnapshot current = clean().usbDebuggingEnabled(true).build();

        ConfigCompareResponse response = service.compare(ConfigCompareRequest.builder()
                .previous(previous).current(current).build());

        assertEquals(1, response.delta().changes().size());
        assertEquals("Device configuration tampering", response.incidents().get(0).title());
        assertSame(current, service.lastSnapshot());
    }
}

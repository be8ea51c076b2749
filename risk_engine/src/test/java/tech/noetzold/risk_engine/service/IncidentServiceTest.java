package tech.noetzold.risk_engine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.repository.impl.InMemoryIncidentRepository;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class IncidentServiceTest {

    private static final Instant T0 = Instant.parse("2026-05-10T12:00:00Z");
    private static final Instant T1 = T0.plusSeconds(3600);

    private IncidentService service;

    @BeforeEach
    void setUp() {
        service = new IncidentService(new InMemoryIncidentRepository());
    }

    private static SecurityIncident incident(String id, Instant at, IncidentSeverity severity, String title) {
        return new SecurityIncident(id, at, at, severity, IncidentStatus.OPEN, title, "summary", "com.example",
                List.of("com.example"), List.of(), List.of(), List.of());
    }

    @Test
    void rescanKeepsStatusAndCreationTime() {
        service.record(incident("inc-1", T0, IncidentSeverity.HIGH, "Stalkerware"));
        service.transition("inc-1", IncidentStatus.INVESTIGATING, T0.plusSeconds(10));

        SecurityIncident merged = service.record(incident("inc-1", T1, IncidentSeverity.CRITICAL, "Stalkerware, escalated"));

        assertEquals(IncidentStatus.INVESTIGATING, merged.status());
        assertEquals(T0, merged.createdAt());
        assertEquals(T1, merged.updatedAt());
        assertEquals(IncidentSeverity.CRITICAL, merged.severity());
        assertEquals("Stalkerware, escalated", service.findById("inc-1").title());
    }

    @Test
    void validTransitionUpdatesTimestamp() {
        service.record(incident("inc-1", T0, IncidentSeverity.HIGH, "Dropper"));

        SecurityIncident resolved = service.transition("inc-1", IncidentStatus.RESOLVED, T1);

        assertEquals(IncidentStatus.RESOLVED, resolved.status());
        assertEquals(T1, resolved.updatedAt());
        assertEquals(List.of(resolved), service.findByStatus(IncidentStatus.RESOLVED));
        assertTrue(service.findByStatus(IncidentStatus.OPEN).isEmpty());
    }

    @Test
    void terminalIncidentsCannotBeReopened() {
        service.record(incident("inc-1", T0, IncidentSeverity.HIGH, "Dropper"));
        service.transition("inc-1", IncidentStatus.FALSE_POSITIVE, T1);

        assertThrows(InvalidTransitionException.class,
                () -> service.transition("inc-1", IncidentStatus.INVESTIGATING, T1));
        assertThrows(InvalidTransitionException.class,
                () -> service.transition("inc-1", IncidentStatus.OPEN, T1));
        assertEquals(IncidentStatus.FALSE_POSITIVE, service.findById("inc-1").status());
    }

    @Test
    void unknownIncidentIsNotFound() {
        assertThrows(NoSuchElementException.class, () -> service.findById("missing"));
        assertThrows(NoSuchElementException.class,
                () -> service.transition("missing", IncidentStatus.RESOLVED, T1));
    }

    @Test
    void findAllListsNewestFirst() {
        service.recordAll(List.of(
                incident("a", T0, IncidentSeverity.LOW, "older"),
                incident("b", T1, IncidentSeverity.LOW, "newer")));

        assertEquals(List.of("b", "a"), service.findAll().stream().map(SecurityIncident::id).toList());
    }
}

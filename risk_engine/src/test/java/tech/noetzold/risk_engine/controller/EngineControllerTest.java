package tech.noetzold.risk_engine.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.service.AppScanService;
import tech.noetzold.risk_engine.service.ConfigMonitorService;
import tech.noetzold.risk_engine.service.IncidentService;
import tech.noetzold.risk_engine.service.InvalidTransitionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EngineController.class)
class EngineControllerTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AppScanService scanService;

    @MockBean
    private ConfigMonitorService configMonitorService;

    @MockBean
    private IncidentService incidentService;

    @MockBean
    private Clock clock;

    private static SecurityIncident incident(String id, IncidentStatus status) {
        return new SecurityIncident(id, NOW, NOW, IncidentSeverity.HIGH, status, "Dropper / malware installer",
                "The app may silently install malicious packages", "com.acme.cleaner", List.of("com.acme.cleaner"),
                List.of(), List.of(), List.of());
    }

    @Test
    void scanWithoutAppIsRejected() throws Exception {
        mockMvc.perform(post("/engine/scan").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value("app must not be null"));

        verifyNoInteractions(scanService);
    }

    @Test
    void scanWithBlankPackageNameIsRejected() throws Exception {
        mockMvc.perform(post("/engine/scan").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"app\":{\"packageName\":\" \"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("app.packageName must not be blank"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/engine/scan").contentType(MediaType.APPLICATION_JSON).content("{\"app\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void unknownBaselineIsNotFound() throws Exception {
        when(scanService.findBaseline("com.never.seen"))
                .thenThrow(new NoSuchElementException("No baseline for package: com.never.seen"));

        mockMvc.perform(get("/engine/baseline").param("package_name", "com.never.seen"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("No baseline for package: com.never.seen"));
    }

    @Test
    void removedAppsAreComputedFromTheGivenPackages() throws Exception {
        when(scanService.findRemovedApps(Set.of("com.example.notes"))).thenReturn(List.of(
                new BaselineComparison("com.acme.toolbox", BaselineStatus.REMOVED, List.of(), false, 4)));

        mockMvc.perform(post("/engine/baseline/removed").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPackages\":[\"com.example.notes\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].packageName").value("com.acme.toolbox"))
                .andExpect(jsonPath("$[0].status").value("REMOVED"));
    }

    @Test
    void incidentsCanBeFilteredByStatus() throws Exception {
        when(incidentService.findByStatus(IncidentStatus.OPEN)).thenReturn(List.of(incident("inc-1", IncidentStatus.OPEN)));

        mockMvc.perform(get("/engine/incidents").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("inc-1"))
                .andExpect(jsonPath("$[0].status").value("OPEN"));

        verify(incidentService, never()).findAll();
    }

    @Test
    void statusChangeIsApplied() throws Exception {
        when(clock.instant()).thenReturn(NOW);
        when(incidentService.transition("inc-1", IncidentStatus.RESOLVED, NOW))
                .thenReturn(incident("inc-1", IncidentStatus.RESOLVED));

        mockMvc.perform(post("/engine/incidents/inc-1/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"RESOLVED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"));
    }

    @Test
    void invalidTransitionIsAConflict() throws Exception {
        when(incidentService.transition(eq("inc-1"), eq(IncidentStatus.OPEN), any()))
                .thenThrow(new InvalidTransitionException("inc-1", IncidentStatus.RESOLVED, IncidentStatus.OPEN));

        mockMvc.perform(post("/engine/incidents/inc-1/status").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"OPEN\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.message").value("Incident inc-1 cannot move from RESOLVED to OPEN"));
    }

    @Test
    void unexpectedFailureIsAServerErrorWithTraceId() throws Exception {
        when(incidentService.findById("inc-1")).thenThrow(new IllegalStateException("MD5 not available"));

        mockMvc.perform(get("/engine/incidents/inc-1").header("X-Trace-Id", "trace-500"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.trace_id").value("trace-500"));
    }

    @Test
    void traceIdIsEchoedBack() throws Exception {
        when(incidentService.findById("inc-1")).thenReturn(incident("inc-1", IncidentStatus.OPEN));

        mockMvc.perform(get("/engine/incidents/inc-1").header("X-Trace-Id", "trace-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-42"))
                .andExpect(jsonPath("$.title").value("Dropper / malware installer"));
    }
}

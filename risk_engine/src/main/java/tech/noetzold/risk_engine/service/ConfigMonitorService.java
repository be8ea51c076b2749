package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.model.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks device configuration between scans and turns drift into events and incidents.
 */
@Slf4j
@Service
public class ConfigMonitorService {

    private final ConfigBaselineEngine configEngine;
    private final EventRecorder eventRecorder;
    private final RootCauseResolver rootCauseResolver;
    private final IncidentService incidentService;
    private final Clock clock;

    private final AtomicReference<ConfigSnapshot> lastSnapshot = new AtomicReference<>();

    public ConfigMonitorService(ConfigBaselineEngine configEngine,
                                EventRecorder eventRecorder,
                                RootCauseResolver rootCauseResolver,
                                IncidentService incidentService,
                                Clock clock) {
        this.configEngine = configEngine;
        this.eventRecorder = eventRecorder;
        this.rootCauseResolver = rootCauseResolver;
        this.incidentService = incidentService;
        this.clock = clock;
    }

    public ConfigCompareResponse compare(ConfigCompareRequest request) {
        Instant now = clock.instant();
        ConfigSnapshot current = request.getCurrent();
        ConfigSnapshot previous = request.getPrevious() != null
                ? request.getPrevious()
                : lastSnapshot.getAndSet(current);
        if (request.getPrevious() != null) {
            lastSnapshot.set(current);
        }

        ConfigDelta delta = configEngine.compareSnapshots(previous, current);
        if (!delta.hasChanges()) {
            return new ConfigCompareResponse(delta, List.of());
        }

        List<SecuritySignal> signals = configEngine.changesToSignals(delta, now);
        List<SecurityIncident> incidents = eventRecorder.recordConfigDelta(delta, signals, now)
                .map(eventRecorder::promote)
                .map(event -> rootCauseResolver.resolveAll(List.of(event), Map.of(), current))
                .map(incidentService::recordAll)
                .orElse(List.of());

        log.info("Config compare: max severity {}, {} incident(s)", delta.maxSeverity(), incidents.size());
        return new ConfigCompareResponse(delta, incidents);
    }

    public ConfigSnapshot lastSnapshot() {
        return lastSnapshot.get();
    }
}

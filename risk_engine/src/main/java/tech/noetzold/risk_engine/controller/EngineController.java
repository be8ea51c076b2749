package tech.noetzold.risk_engine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.risk_engine.model.*;
import tech.noetzold.risk_engine.service.AppScanService;
import tech.noetzold.risk_engine.service.ConfigMonitorService;
import tech.noetzold.risk_engine.service.IncidentService;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/engine")
@RequiredArgsConstructor
public class EngineController {

    private final AppScanService scanService;
    private final ConfigMonitorService configMonitorService;
    private final IncidentService incidentService;
    private final Clock clock;

    @Tag(name = "Scan")
    @Operation(summary = "Avalia um app e atualiza o baseline")
    @PostMapping("/scan")
    public ScanResult scan(@Valid @RequestBody ScanRequest request) {
        return scanService.scanApp(request);
    }

    @Tag(name = "Scan")
    @Operation(summary = "Avalia um lote de apps em paralelo")
    @PostMapping("/scan/batch")
    public BatchScanResponse scanBatch(@Valid @RequestBody BatchScanRequest request) {
        return scanService.scanBatch(request);
    }

    @Tag(name = "Scan")
    @GetMapping("/baseline")
    public BaselineRecord baseline(@RequestParam("package_name") String packageName) {
        return scanService.findBaseline(packageName);
    }

    @Tag(name = "Scan")
    @PostMapping("/baseline/removed")
    public List<BaselineComparison> removedApps(@Valid @RequestBody RemovedAppsRequest request) {
        return scanService.findRemovedApps(request.getCurrentPackages());
    }

    @Tag(name = "Config")
    @Operation(summary = "Compara a configuração atual do dispositivo com a anterior")
    @PostMapping("/config/compare")
    public ConfigCompareResponse compareConfig(@Valid @RequestBody ConfigCompareRequest request) {
        return configMonitorService.compare(request);
    }

    @Tag(name = "Incidents")
    @GetMapping("/incidents")
    public List<SecurityIncident> incidents(@RequestParam(value = "status", required = false) IncidentStatus status) {
        return status == null ? incidentService.findAll() : incidentService.findByStatus(status);
    }

    @Tag(name = "Incidents")
    @GetMapping("/incidents/{id}")
    public SecurityIncident incident(@PathVariable("id") String id) {
        return incidentService.findById(id);
    }

    @Tag(name = "Incidents")
    @Operation(summary = "Altera o status de um incidente")
    @PostMapping("/incidents/{id}/status")
    public SecurityIncident changeStatus(@PathVariable("id") String id,
                                         @Valid @RequestBody StatusChangeRequest request) {
        return incidentService.transition(id, request.getStatus(), clock.instant());
    }
}

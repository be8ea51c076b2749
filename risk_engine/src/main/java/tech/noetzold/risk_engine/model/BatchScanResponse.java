package tech.noetzold.risk_engine.model;

import java.util.List;

public record BatchScanResponse(
        List<ScanResult> results,
        List<BaselineComparison> removed,
        ScanDiagnostics diagnostics,
        int appsSecurityScore
) {}

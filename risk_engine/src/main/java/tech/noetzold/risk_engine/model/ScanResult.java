package tech.noetzold.risk_engine.model;

import java.util.List;

public record ScanResult(
        String packageName,
        AppCategory category,
        TrustEvidence trust,
        BaselineComparison baseline,
        AppVerdict verdict,
        AppFeatureVector features,
        TimelineResult timeline,
        List<SecurityIncident> incidents
) {}

package tech.noetzold.risk_engine.model;

import java.util.List;

public record BaselineComparison(
        String packageName,
        BaselineStatus status,
        List<BaselineAnomaly> anomalies,
        boolean isFirstScan,
        int scanCount
) {
    public boolean hasAnomaly(AnomalyType type) {
        return anomalies.stream().anyMatch(a -> a.type() == type);
    }
}

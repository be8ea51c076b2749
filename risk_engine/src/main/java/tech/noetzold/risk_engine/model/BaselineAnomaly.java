package tech.noetzold.risk_engine.model;

public record BaselineAnomaly(
        AnomalyType type,
        AnomalySeverity severity,
        String description,
        String details
) {}

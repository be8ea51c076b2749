package tech.noetzold.risk_engine.model;

public record ConfigChange(
        ConfigChangeType type,
        SignalSeverity severity,
        String description,
        String oldValue,
        String newValue,
        String relatedPackage
) {}

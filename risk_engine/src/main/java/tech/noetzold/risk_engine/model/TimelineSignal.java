package tech.noetzold.risk_engine.model;

public record TimelineSignal(
        TimelineSignalType type,
        String description,
        double weight,
        Long timeAfterInstallMs
) {}

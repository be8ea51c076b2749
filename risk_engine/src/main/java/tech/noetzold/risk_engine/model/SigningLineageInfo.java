package tech.noetzold.risk_engine.model;

public record SigningLineageInfo(
        boolean hasLineage,
        int lineageLength,
        boolean lineageTrusted
) {}

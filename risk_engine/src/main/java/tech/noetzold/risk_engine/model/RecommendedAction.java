package tech.noetzold.risk_engine.model;

public record RecommendedAction(
        int priority,
        ActionCategory type,
        String title,
        String description,
        String targetPackage
) {}

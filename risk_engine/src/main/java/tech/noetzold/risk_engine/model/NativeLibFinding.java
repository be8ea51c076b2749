package tech.noetzold.risk_engine.model;

public record NativeLibFinding(
        String name,
        boolean isSuspicious,
        String suspicionType
) {}

package tech.noetzold.risk_engine.model;

public record TrustReason(
        String evidence,
        int contribution,
        boolean isPositive
) {}

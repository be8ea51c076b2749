package tech.noetzold.risk_engine.model;

public enum EffectiveRisk {
    CRITICAL,
    NEEDS_ATTENTION,
    INFO,
    SAFE
}

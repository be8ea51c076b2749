package tech.noetzold.risk_engine.model;

public enum InstallPhase {
    IMMEDIATE,
    SHORT_TERM,
    MEDIUM_TERM,
    ESTABLISHED,
    NOT_APPLICABLE
}

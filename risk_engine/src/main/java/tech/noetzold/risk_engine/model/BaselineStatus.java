package tech.noetzold.risk_engine.model;

public enum BaselineStatus {
    NEW,
    UNCHANGED,
    CHANGED,
    REMOVED
}

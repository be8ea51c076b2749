package tech.noetzold.risk_engine.model;

public enum VerifiedBootState {
    GREEN,
    YELLOW,
    ORANGE,
    RED,
    UNKNOWN
}

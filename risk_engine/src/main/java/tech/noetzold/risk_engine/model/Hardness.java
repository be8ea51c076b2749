package tech.noetzold.risk_engine.model;

public enum Hardness {
    /** Never reduced by trust or policy. */
    HARD,
    /** Reduced by trust, suppressed for system hygiene. */
    SOFT,
    /** Only meaningful in combination with other evidence. */
    WEAK_SIGNAL
}

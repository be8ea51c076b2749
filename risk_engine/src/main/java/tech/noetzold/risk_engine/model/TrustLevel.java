package tech.noetzold.risk_engine.model;

public enum TrustLevel {
    HIGH,
    MODERATE,
    LOW,
    ANOMALOUS;

    public static TrustLevel fromScore(int score) {
        if (score >= 70) return HIGH;
        if (score >= 40) return MODERATE;
        return LOW;
    }
}

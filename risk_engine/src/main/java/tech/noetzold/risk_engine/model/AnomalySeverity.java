package tech.noetzold.risk_engine.model;

public enum AnomalySeverity {
    CRITICAL(RiskLevel.CRITICAL),
    HIGH(RiskLevel.HIGH),
    MEDIUM(RiskLevel.MEDIUM),
    LOW(RiskLevel.LOW);

    private final RiskLevel riskLevel;

    AnomalySeverity(RiskLevel riskLevel) {
        this.riskLevel = riskLevel;
    }

    public RiskLevel toRiskLevel() {
        return riskLevel;
    }
}

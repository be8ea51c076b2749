package tech.noetzold.risk_engine.model;

public record RawFinding(
        FindingType type,
        RiskLevel severity,
        String title,
        String description
) {
    public Hardness hardness() {
        return type.hardness();
    }
}

package tech.noetzold.risk_engine.model;

public record AdjustedFinding(
        FindingType findingType,
        RiskLevel originalSeverity,
        RiskLevel adjustedSeverity,
        Hardness hardness,
        boolean wasDowngraded,
        String title,
        String description
) {
    public boolean isVisible() {
        return adjustedSeverity != RiskLevel.NONE;
    }

    /**
     * Lower value explains first: hardness tier, then severity.
     */
    public int explainPriority() {
        int tier = switch (hardness) {
            case HARD -> 0;
            case SOFT -> 100;
            case WEAK_SIGNAL -> 200;
        };
        return tier + (RiskLevel.CRITICAL.rank() - adjustedSeverity.rank());
    }
}

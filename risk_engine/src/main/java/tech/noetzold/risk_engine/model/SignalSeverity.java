package tech.noetzold.risk_engine.model;

public enum SignalSeverity {
    CRITICAL(40),
    HIGH(25),
    MEDIUM(15),
    LOW(5),
    INFO(1);

    private final int weight;

    SignalSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public static SignalSeverity from(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }

    public static SignalSeverity from(RiskLevel level) {
        return switch (level) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
            case NONE -> INFO;
        };
    }
}

package tech.noetzold.risk_engine.model;

/**
 * Finding severity. Ordering is defined by {@link #rank()}, never by declaration order.
 */
public enum RiskLevel {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    NONE(0);

    private static final RiskLevel[] BY_RANK = {NONE, LOW, MEDIUM, HIGH, CRITICAL};

    private final int rank;

    RiskLevel(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(RiskLevel other) {
        return rank >= other.rank;
    }

    public RiskLevel downgrade(int levels) {
        return fromRank(rank - levels);
    }

    public static RiskLevel fromRank(int rank) {
        return BY_RANK[Math.max(0, Math.min(BY_RANK.length - 1, rank))];
    }
}

package tech.noetzold.risk_engine.model;

import java.util.List;

public record TimelineResult(
        String packageName,
        double score,
        InstallPhase phase,
        List<TimelineSignal> signals,
        boolean isFreshInstall,
        long installAgeMs
) {
    public static final double DROPPER_CANDIDATE_THRESHOLD = 0.30;
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.55;

    public boolean isDropperCandidate() {
        return score >= DROPPER_CANDIDATE_THRESHOLD;
    }

    public boolean isHighConfidenceDropper() {
        return score >= HIGH_CONFIDENCE_THRESHOLD;
    }

    public boolean hasSignal(TimelineSignalType type) {
        return signals.stream().anyMatch(s -> s.type() == type);
    }
}

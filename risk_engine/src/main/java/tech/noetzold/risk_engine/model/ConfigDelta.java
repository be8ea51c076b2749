package tech.noetzold.risk_engine.model;

import java.util.Comparator;
import java.util.List;

public record ConfigDelta(
        String oldHash,
        String newHash,
        List<ConfigChange> changes
) {
    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public SignalSeverity maxSeverity() {
        return changes.stream()
                .map(ConfigChange::severity)
                .max(Comparator.comparingInt(SignalSeverity::weight))
                .orElse(SignalSeverity.INFO);
    }
}

package tech.noetzold.risk_engine.model;

import java.time.Instant;
import java.util.List;

public record SecurityIncident(
        String id,
        Instant createdAt,
        Instant updatedAt,
        IncidentSeverity severity,
        IncidentStatus status,
        String title,
        String summary,
        String packageName,
        List<String> affectedPackages,
        List<SecurityEvent> events,
        List<Hypothesis> hypotheses,
        List<RecommendedAction> recommendedActions
) {
    public Hypothesis topHypothesis() {
        return hypotheses.isEmpty() ? null : hypotheses.get(0);
    }

    public SecurityIncident withStatus(IncidentStatus newStatus, Instant now) {
        return new SecurityIncident(id, createdAt, now, severity, newStatus, title, summary,
                packageName, affectedPackages, events, hypotheses, recommendedActions);
    }
}

package tech.noetzold.risk_engine.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.risk_engine.model.SecurityIncident;
import tech.noetzold.risk_engine.repository.IncidentRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryIncidentRepository implements IncidentRepository {
    private final Map<String, SecurityIncident> db = new ConcurrentHashMap<>();

    @Override
    public Optional<SecurityIncident> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(db.get(id));
    }

    @Override
    public SecurityIncident save(SecurityIncident incident) {
        db.put(incident.id(), incident);
        return incident;
    }

    @Override
    public List<SecurityIncident> findAll() {
        return db.values().stream()
                .sorted(Comparator.comparing(SecurityIncident::createdAt,
                                Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(SecurityIncident::id))
                .toList();
    }
}

package tech.noetzold.risk_engine.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.risk_engine.model.SecurityEvent;
import tech.noetzold.risk_engine.repository.SecurityEventRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySecurityEventRepository implements SecurityEventRepository {
    private final Map<String, SecurityEvent> db = new ConcurrentHashMap<>();

    @Override
    public SecurityEvent save(SecurityEvent event) {
        db.put(event.id(), event);
        return event;
    }

    @Override
    public List<SecurityEvent> findAll() {
        return db.values().stream()
                .sorted(Comparator.comparing(SecurityEvent::startTime).thenComparing(SecurityEvent::id))
                .toList();
    }

    @Override
    public List<SecurityEvent> findSince(Instant since) {
        return findAll().stream()
                .filter(e -> !e.startTime().isBefore(since))
                .toList();
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int before = db.size();
        db.values().removeIf(e -> e.startTime().isBefore(cutoff));
        return before - db.size();
    }
}

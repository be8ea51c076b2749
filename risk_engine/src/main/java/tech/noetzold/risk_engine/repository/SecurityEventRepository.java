package tech.noetzold.risk_engine.repository;

import tech.noetzold.risk_engine.model.SecurityEvent;

import java.time.Instant;
import java.util.List;

public interface SecurityEventRepository {
    /** Replaces an event with the same id. */
    SecurityEvent save(SecurityEvent event);

    List<SecurityEvent> findAll();

    List<SecurityEvent> findSince(Instant since);

    int deleteOlderThan(Instant cutoff);
}

package tech.noetzold.risk_engine.repository;

import tech.noetzold.risk_engine.model.SecurityIncident;

import java.util.List;
import java.util.Optional;

public interface IncidentRepository {
    Optional<SecurityIncident> findById(String id);

    SecurityIncident save(SecurityIncident incident);

    List<SecurityIncident> findAll();
}

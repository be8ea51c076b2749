package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.model.IncidentStatus;
import tech.noetzold.risk_engine.model.SecurityIncident;
import tech.noetzold.risk_engine.repository.IncidentRepository;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@Service
public class IncidentService {

    private final IncidentRepository incidentRepository;

    public IncidentService(IncidentRepository incidentRepository) {
        this.incidentRepository = incidentRepository;
    }

    /**
     * Stores a freshly resolved incident. An incident that already exists under the same id keeps
     * its status and creation time, so a closed incident is not reopened by a rescan.
     */
    public SecurityIncident record(SecurityIncident incident) {
        Optional<SecurityIncident> existing = incidentRepository.findById(incident.id());
        if (existing.isEmpty()) {
            log.info("Incident opened: {} [{}] {}", incident.id(), incident.severity(), incident.title());
            return incidentRepository.save(incident);
        }
        SecurityIncident previous = existing.get();
        SecurityIncident merged = new SecurityIncident(
                incident.id(),
                previous.createdAt(),
                incident.updatedAt(),
                incident.severity(),
                previous.status(),
                incident.title(),
                incident.summary(),
                incident.packageName(),
                incident.affectedPackages(),
                incident.events(),
                incident.hypotheses(),
                incident.recommendedActions());
        return incidentRepository.save(merged);
    }

    public List<SecurityIncident> recordAll(List<SecurityIncident> incidents) {
        return incidents.stream().map(this::record).toList();
    }

    public List<SecurityIncident> findAll() {
        return incidentRepository.findAll();
    }

    public List<SecurityIncident> findByStatus(IncidentStatus status) {
        return incidentRepository.findAll().stream()
                .filter(i -> i.status() == status)
                .toList();
    }

    public SecurityIncident findById(String id) {
        return incidentRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Incident not found: " + id));
    }

    public SecurityIncident transition(String id, IncidentStatus newStatus, Instant now) {
        SecurityIncident incident = findById(id);
        if (!incident.status().canTransitionTo(newStatus)) {
            log.warn("Rejected incident transition {}: {} -> {}", id, incident.status(), newStatus);
            throw new InvalidTransitionException(id, incident.status(), newStatus);
        }
        SecurityIncident updated = incident.withStatus(newStatus, now);
        log.info("Incident {} moved {} -> {}", id, incident.status(), newStatus);
        return incidentRepository.save(updated);
    }
}

package tech.noetzold.risk_engine.service;

import tech.noetzold.risk_engine.model.IncidentStatus;

/**
 * Thrown when an incident is asked to leave its status for one the state machine does not allow.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final IncidentStatus from;
    private final IncidentStatus to;

    public InvalidTransitionException(String incidentId, IncidentStatus from, IncidentStatus to) {
        super("Incident " + incidentId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public IncidentStatus getFrom() {
        return from;
    }

    public IncidentStatus getTo() {
        return to;
    }
}

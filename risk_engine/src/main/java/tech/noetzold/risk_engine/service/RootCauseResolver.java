package tech.noetzold.risk_engine.service;

import tech.noetzold.risk_engine.model.AppFeatureVector;
import tech.noetzold.risk_engine.model.ConfigSnapshot;
import tech.noetzold.risk_engine.model.SecurityEvent;
import tech.noetzold.risk_engine.model.SecurityIncident;

import java.util.List;
import java.util.Map;

/**
 * Ranks hypotheses explaining why a security event happened and turns the event into an incident.
 */
public interface RootCauseResolver {

    /**
     * @param event        event to explain
     * @param appKnowledge feature vector of the affected package, null for device-level events
     * @param config       current device configuration, may be null
     * @param recentEvents other recent events used for correlation
     */
    SecurityIncident resolve(SecurityEvent event,
                             AppFeatureVector appKnowledge,
                             ConfigSnapshot config,
                             List<SecurityEvent> recentEvents);

    /**
     * Groups events by package and resolves each group independently. The recent events handed to
     * each resolution are the events of all other groups.
     */
    List<SecurityIncident> resolveAll(List<SecurityEvent> events,
                                      Map<String, AppFeatureVector> appKnowledge,
                                      ConfigSnapshot config);
}

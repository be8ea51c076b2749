package tech.noetzold.risk_engine.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record DangerousCombo(
        String name,
        String description,
        Set<CapabilityCluster> requiredClusters,
        boolean requiresLowTrust,
        boolean requiresSideload,
        boolean requiresDebugCert,
        boolean respectCategoryWhitelist,
        RiskLevel severity
) {
    public DangerousCombo {
        requiredClusters = Collections.unmodifiableSet(EnumSet.copyOf(requiredClusters));
    }
}

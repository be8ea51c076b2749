package tech.noetzold.risk_engine.model;

import java.util.List;
import java.util.Set;

public record AppVerdict(
        String packageName,
        int trustScore,
        TrustLevel trustLevel,
        int riskScore,
        EffectiveRisk effectiveRisk,
        PolicyProfile policyProfile,
        List<AdjustedFinding> adjustedFindings,
        Set<CapabilityCluster> activeClusters,
        Set<CapabilityCluster> unexpectedClusters,
        List<String> matchedCombos,
        List<String> privacyCapabilities,
        List<String> topReasons,
        boolean shouldShowInMainList
) {
    public long hardFindingCount() {
        return adjustedFindings.stream()
                .filter(f -> f.hardness() == Hardness.HARD && f.isVisible())
                .count();
    }

    public long softFindingCount() {
        return adjustedFindings.stream()
                .filter(f -> f.hardness() == Hardness.SOFT && f.isVisible())
                .count();
    }
}

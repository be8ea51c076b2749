package tech.noetzold.risk_engine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Inputs of a single verdict evaluation.
 */
@Getter
@Builder(toBuilder = true)
public class EvaluationContext {
    private final String packageName;
    private final TrustEvidence trustEvidence;
    @Singular
    private final List<RawFinding> rawFindings;
    @Singular
    private final List<String> grantedPermissions;
    @Builder.Default
    private final AppCategory category = AppCategory.OTHER;
    private final boolean isSystemApp;
    private final boolean isNewApp;
    private final SpecialAccessSnapshot specialAccessSnapshot;
    @Builder.Default
    private final InstallClass installClass = InstallClass.USER_INSTALLED;
    private final PolicyProfile policyProfileOverride;
}

package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.catalog.AndroidPermissions;
import tech.noetzold.risk_engine.catalog.CategoryWhitelist;
import tech.noetzold.risk_engine.catalog.DangerousComboCatalog;
import tech.noetzold.risk_engine.model.*;

import java.util.*;
import java.util.stream.Stream;

/**
 * Verdict engine. Combines identity (trust), findings (with their hardness) and capabilities
 * (clusters and combos) into one of four effective risk tiers.
 *
 * <p>The verdict is decided by a first-match rule chain. The order of the rules is part of the
 * contract: a HARD finding always wins, and a high-risk capability alone never escalates past
 * INFO without a corroborating signal.</p>
 */
@Slf4j
@Service
public class TrustRiskModel {

    static final int LOW_TRUST_BELOW = 40;
    static final int HIGH_TRUST_FROM = 70;

    private static final Set<CapabilityCluster> INSTALLER_CHANGE_DANGEROUS = EnumSet.of(
            CapabilityCluster.ACCESSIBILITY,
            CapabilityCluster.NOTIFICATION_LISTENER,
            CapabilityCluster.VPN,
            CapabilityCluster.INSTALL_PACKAGES,
            CapabilityCluster.DEVICE_ADMIN);

    private final CategoryWhitelist whitelist;
    private final DangerousComboCatalog comboCatalog;

    public TrustRiskModel(CategoryWhitelist whitelist, DangerousComboCatalog comboCatalog) {
        this.whitelist = whitelist;
        this.comboCatalog = comboCatalog;
    }

    public InstallClass classifyInstall(boolean isSystemApp, InstallerType installerType, AppPartition partition) {
        if (installerType == InstallerType.MDM_INSTALLER) return InstallClass.ENTERPRISE_MANAGED;
        if (isSystemApp || (partition != null && partition.isSystemPartition())) {
            return InstallClass.SYSTEM_PREINSTALLED;
        }
        return InstallClass.USER_INSTALLED;
    }

    public PolicyProfile policyProfileFor(InstallClass installClass) {
        return PolicyProfile.forInstallClass(installClass);
    }

    public boolean isClusterExpectedForCategory(CapabilityCluster cluster, AppCategory category, int trustScore) {
        return whitelist.isExpected(cluster, category, trustScore);
    }

    public boolean isClusterExpectedForCategory(CapabilityCluster cluster, AppCategory category) {
        return whitelist.isExpected(cluster, category);
    }

    public AppVerdict evaluate(EvaluationContext ctx) {
        TrustEvidence trust = Objects.requireNonNull(ctx.getTrustEvidence(), "trustEvidence");
        int trustScore = trust.trustScore();
        AppCategory category = ctx.getCategory() != null ? ctx.getCategory() : AppCategory.OTHER;
        InstallClass installClass = ctx.getInstallClass() != null ? ctx.getInstallClass() : InstallClass.USER_INSTALLED;
        PolicyProfile profile = ctx.getPolicyProfileOverride() != null
                ? ctx.getPolicyProfileOverride()
                : policyProfileFor(installClass);
        // a finding without a type carries nothing to decide on
        List<RawFinding> rawFindings = ctx.getRawFindings().stream()
                .filter(f -> f != null && f.type() != null)
                .toList();

        // active and unexpected capability clusters
        Set<CapabilityCluster> active = activeClusters(ctx.getGrantedPermissions(), ctx.getSpecialAccessSnapshot());
        Set<CapabilityCluster> unexpected = EnumSet.noneOf(CapabilityCluster.class);
        for (CapabilityCluster cluster : active) {
            if (cluster.isHighRisk() && !whitelist.isExpected(cluster, category, trustScore)) {
                unexpected.add(cluster);
            }
        }

        // dangerous combos
        boolean debugSigned = hasFinding(rawFindings, FindingType.DEBUG_SIGNATURE);
        List<DangerousCombo> matched = comboCatalog.combos().stream()
                .filter(c -> matchesCombo(c, active, trust, debugSigned, category))
                .toList();

        // trust-aware finding adjustment
        List<AdjustedFinding> adjusted = rawFindings.stream()
                .map(f -> adjustFinding(f, trustScore, profile))
                .toList();

        // first matching rule wins
        EffectiveRisk risk = decide(trust, rawFindings, adjusted, active, unexpected, matched, profile, ctx.isNewApp());

        int riskScore = riskScore(adjusted, matched);
        List<String> topReasons = topReasons(risk, matched, adjusted);
        List<String> privacy = privacyCapabilities(ctx.getGrantedPermissions(), category);
        boolean showInMainList = ctx.isSystemApp()
                ? (risk == EffectiveRisk.CRITICAL || risk == EffectiveRisk.NEEDS_ATTENTION)
                : risk != EffectiveRisk.SAFE;

        String packageName = ctx.getPackageName() != null ? ctx.getPackageName() : trust.packageName();
        log.debug("Verdict for {}: {} (trust={}, profile={}, combos={}, findings={})",
                packageName, risk, trustScore, profile, matched.size(), adjusted.size());

        return new AppVerdict(
                packageName,
                trustScore,
                trust.trustLevel(),
                riskScore,
                risk,
                profile,
                adjusted,
                Collections.unmodifiableSet(active),
                Collections.unmodifiableSet(unexpected),
                matched.stream().map(DangerousCombo::name).toList(),
                privacy,
                topReasons,
                showInMainList
        );
    }

    /**
     * A cluster backed by a toggleable service only counts when the snapshot confirms it is
     * switched on. Without a snapshot the granted permission decides alone.
     */
    public Set<CapabilityCluster> activeClusters(Collection<String> grantedPermissions, SpecialAccessSnapshot snapshot) {
        Set<CapabilityCluster> active = EnumSet.noneOf(CapabilityCluster.class);
        if (grantedPermissions == null) return active;
        for (CapabilityCluster cluster : CapabilityCluster.values()) {
            if (!cluster.isActive(grantedPermissions)) continue;
            if (cluster.isSpecialAccessBacked() && snapshot != null && !cluster.isEnabledIn(snapshot)) continue;
            active.add(cluster);
        }
        return active;
    }

    public boolean matchesCombo(DangerousCombo combo, Set<CapabilityCluster> active, TrustEvidence trust,
                                boolean debugSigned, AppCategory category) {
        if (!active.containsAll(combo.requiredClusters())) return false;
        if (combo.requiresLowTrust() && trust.trustScore() >= LOW_TRUST_BELOW) return false;
        if (combo.requiresSideload() && !trust.isSideloaded()) return false;
        if (combo.requiresDebugCert() && !debugSigned) return false;
        if (combo.respectCategoryWhitelist()) {
            boolean anyUnexpected = combo.requiredClusters().stream()
                    .anyMatch(c -> !whitelist.isExpected(c, category, trust.trustScore()));
            if (!anyUnexpected) return false;
        }
        return true;
    }

    public AdjustedFinding adjustFinding(RawFinding finding, int trustScore, PolicyProfile profile) {
        RiskLevel original = finding.severity() != null ? finding.severity() : RiskLevel.NONE;
        FindingType type = finding.type();
        boolean suppressedHygiene = profile == PolicyProfile.SYSTEM && type.isSystemHygiene();

        RiskLevel adjusted = switch (type.hardness()) {
            case HARD -> original;
            case SOFT -> {
                if (suppressedHygiene) yield RiskLevel.NONE;
                if (trustScore >= HIGH_TRUST_FROM) yield original.downgrade(2);
                if (trustScore >= LOW_TRUST_BELOW) yield original.downgrade(1);
                yield original;
            }
            case WEAK_SIGNAL -> {
                if (suppressedHygiene || trustScore >= HIGH_TRUST_FROM) yield RiskLevel.NONE;
                if (trustScore >= LOW_TRUST_BELOW) yield original.downgrade(2);
                yield original.downgrade(1);
            }
        };

        return new AdjustedFinding(
                type,
                original,
                adjusted,
                type.hardness(),
                adjusted.rank() < original.rank(),
                finding.title() != null ? finding.title() : type.name(),
                finding.description()
        );
    }

    private EffectiveRisk decide(TrustEvidence trust,
                                 List<RawFinding> raw,
                                 List<AdjustedFinding> adjusted,
                                 Set<CapabilityCluster> active,
                                 Set<CapabilityCluster> unexpected,
                                 List<DangerousCombo> combos,
                                 PolicyProfile profile,
                                 boolean isNewApp) {
        boolean lowTrust = trust.trustScore() < LOW_TRUST_BELOW;
        boolean highTrust = trust.trustScore() >= HIGH_TRUST_FROM;

        // 1
        boolean hardHit = adjusted.stream().anyMatch(f ->
                f.hardness() == Hardness.HARD && f.adjustedSeverity().isAtLeast(RiskLevel.MEDIUM));
        if (hardHit) return EffectiveRisk.CRITICAL;
        // 2
        if (trust.trustLevel() == TrustLevel.ANOMALOUS) return EffectiveRisk.CRITICAL;
        // 3
        if (combos.stream().anyMatch(c -> c.severity().isAtLeast(RiskLevel.CRITICAL))) return EffectiveRisk.CRITICAL;
        // 4
        if (combos.stream().anyMatch(c -> c.severity().isAtLeast(RiskLevel.HIGH))) return EffectiveRisk.NEEDS_ATTENTION;
        // 5
        if (hasFinding(raw, FindingType.INSTALLER_ANOMALY) && trust.isSideloaded()
                && active.stream().anyMatch(INSTALLER_CHANGE_DANGEROUS::contains)) {
            return EffectiveRisk.NEEDS_ATTENTION;
        }
        boolean permAdded = hasFinding(raw, FindingType.HIGH_RISK_PERMISSION_ADDED);
        // 6
        if (permAdded && lowTrust) return EffectiveRisk.NEEDS_ATTENTION;
        // 7
        if (lowTrust && !unexpected.isEmpty() && hasExtraSignal(trust, raw, isNewApp)) {
            return EffectiveRisk.NEEDS_ATTENTION;
        }
        // 8
        if (permAdded) return EffectiveRisk.INFO;
        // 9
        if (hasFinding(raw, FindingType.EXPORTED_SURFACE_INCREASED) && lowTrust) return EffectiveRisk.INFO;
        // 10
        if (!unexpected.isEmpty() && !highTrust) return EffectiveRisk.INFO;
        // 11
        int weightedSum = adjusted.stream().mapToInt(f -> findingWeight(f, profile)).sum();
        if (weightedSum >= profile.infoThreshold()) return EffectiveRisk.INFO;
        // 12
        return EffectiveRisk.SAFE;
    }

    private boolean hasExtraSignal(TrustEvidence trust, List<RawFinding> raw, boolean isNewApp) {
        if (trust.isSideloaded() || isNewApp) return true;
        return raw.stream().anyMatch(f -> f.type().isBaselineDelta()
                || f.type() == FindingType.SUSPICIOUS_NATIVE_LIB);
    }

    int findingWeight(AdjustedFinding finding, PolicyProfile profile) {
        if (!finding.isVisible()) return 0;
        return switch (finding.hardness()) {
            case HARD -> 10;
            case SOFT -> profile == PolicyProfile.SYSTEM && finding.findingType().isSystemHygiene()
                    ? 0
                    : Math.min(3, finding.adjustedSeverity().rank());
            case WEAK_SIGNAL -> profile == PolicyProfile.SYSTEM ? 0 : 1;
        };
    }

    int riskScore(List<AdjustedFinding> findings, List<DangerousCombo> combos) {
        int score = 0;
        for (AdjustedFinding f : findings) {
            score += switch (f.hardness()) {
                case HARD -> severityPoints(f.adjustedSeverity(), 30, 20, 10, 5);
                case SOFT -> severityPoints(f.adjustedSeverity(), 15, 10, 5, 2);
                case WEAK_SIGNAL -> 0;
            };
        }
        for (DangerousCombo combo : combos) {
            score += severityPoints(combo.severity(), 40, 25, 15, 5);
        }
        return Math.max(0, Math.min(100, score));
    }

    private static int severityPoints(RiskLevel level, int critical, int high, int medium, int low) {
        return switch (level) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case NONE -> 0;
        };
    }

    private List<String> topReasons(EffectiveRisk risk, List<DangerousCombo> combos, List<AdjustedFinding> findings) {
        int limit = switch (risk) {
            case CRITICAL -> 3;
            case NEEDS_ATTENTION -> 2;
            case INFO, SAFE -> 0;
        };
        if (limit == 0) return List.of();

        Comparator<AdjustedFinding> byPriority = Comparator
                .comparingInt(AdjustedFinding::explainPriority)
                .thenComparing(AdjustedFinding::title);
        Stream<String> hard = findings.stream()
                .filter(f -> f.hardness() == Hardness.HARD && f.isVisible())
                .sorted(byPriority)
                .map(AdjustedFinding::title);
        Stream<String> soft = findings.stream()
                .filter(f -> f.hardness() == Hardness.SOFT && f.isVisible())
                .sorted(byPriority)
                .map(AdjustedFinding::title);

        return Stream.of(combos.stream().map(DangerousCombo::name), hard, soft)
                .flatMap(s -> s)
                .distinct()
                .limit(limit)
                .toList();
    }

    private List<String> privacyCapabilities(List<String> granted, AppCategory category) {
        if (granted == null) return List.of();
        return granted.stream()
                .filter(Objects::nonNull)
                .distinct()
                .filter(AndroidPermissions.PRIVACY_PERMISSIONS::containsKey)
                .map(p -> {
                    String label = AndroidPermissions.PRIVACY_PERMISSIONS.get(p);
                    return category.expects(p) ? label + " (expected)" : label;
                })
                .toList();
    }

    private static boolean hasFinding(List<RawFinding> findings, FindingType type) {
        return findings.stream().anyMatch(f -> f.type() == type);
    }
}

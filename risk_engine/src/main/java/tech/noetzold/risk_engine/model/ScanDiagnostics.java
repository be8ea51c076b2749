package tech.noetzold.risk_engine.model;

import java.util.*;

/**
 * Aggregate view over one batch of verdicts, used to tune the model and for the batch response.
 */
public record ScanDiagnostics(
        int totalApps,
        Map<EffectiveRisk, Integer> perVerdictCounts,
        List<TriggerSummary> topTriggers,
        double unknownInstallerPercent,
        double unknownCategoryPercent,
        Map<String, Integer> comboMatchCounts,
        int hardFindingCount,
        double averageTrustScore
) {
    public record TriggerSummary(FindingType findingType, int count) {}

    public static ScanDiagnostics empty() {
        return new ScanDiagnostics(0, Map.of(), List.of(), 0.0, 0.0, Map.of(), 0, 0.0);
    }

    public static ScanDiagnostics fromVerdicts(List<AppVerdict> verdicts,
                                               Map<String, AppCategory> categories,
                                               Map<String, InstallerType> installerTypes) {
        int total = verdicts.size();
        if (total == 0) return empty();

        Map<EffectiveRisk, Integer> perVerdict = new EnumMap<>(EffectiveRisk.class);
        Map<FindingType, Integer> triggers = new EnumMap<>(FindingType.class);
        Map<String, Integer> combos = new TreeMap<>();
        int hard = 0;
        long trustSum = 0;

        for (AppVerdict verdict : verdicts) {
            perVerdict.merge(verdict.effectiveRisk(), 1, Integer::sum);
            for (AdjustedFinding f : verdict.adjustedFindings()) {
                triggers.merge(f.findingType(), 1, Integer::sum);
                if (f.hardness() == Hardness.HARD && f.adjustedSeverity().isAtLeast(RiskLevel.MEDIUM)) hard++;
            }
            verdict.matchedCombos().forEach(c -> combos.merge(c, 1, Integer::sum));
            trustSum += verdict.trustScore();
        }

        List<TriggerSummary> topTriggers = triggers.entrySet().stream()
                .sorted(Map.Entry.<FindingType, Integer>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().name()))
                .map(e -> new TriggerSummary(e.getKey(), e.getValue()))
                .toList();

        long unknownInstallers = installerTypes.values().stream().filter(t -> t == InstallerType.UNKNOWN).count();
        long unknownCategories = categories.values().stream().filter(c -> c == AppCategory.OTHER).count();

        return new ScanDiagnostics(
                total,
                Collections.unmodifiableMap(perVerdict),
                topTriggers,
                unknownInstallers * 100.0 / total,
                unknownCategories * 100.0 / total,
                Collections.unmodifiableMap(combos),
                hard,
                (double) trustSum / total);
    }

    public int count(EffectiveRisk risk) {
        return perVerdictCounts.getOrDefault(risk, 0);
    }

    /** 100 minus 20 per CRITICAL app and 5 per NEEDS_ATTENTION app, never below 0. */
    public int appsSecurityScore() {
        return Math.max(0, 100 - 20 * count(EffectiveRisk.CRITICAL) - 5 * count(EffectiveRisk.NEEDS_ATTENTION));
    }
}

package tech.noetzold.risk_engine.model;

import java.util.List;

public record Hypothesis(
        String name,
        String description,
        double confidence,
        List<String> supportingEvidence,
        List<String> contradictingEvidence,
        List<String> mitreTechniques
) {}

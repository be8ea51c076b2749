package tech.noetzold.risk_engine.model;

import java.util.List;

public record ConfigCompareResponse(
        ConfigDelta delta,
        List<SecurityIncident> incidents
) {}

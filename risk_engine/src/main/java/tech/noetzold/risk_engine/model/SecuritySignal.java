package tech.noetzold.risk_engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * Atomic observation. Many are emitted per scan.
 */
public record SecuritySignal(
        String id,
        Instant timestamp,
        SignalSource source,
        SignalType type,
        SignalSeverity severity,
        String packageName,
        String summary,
        Map<String, String> details
) {}

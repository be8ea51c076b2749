package tech.noetzold.risk_engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Signals grouped over a time window for one package, or for the device when packageName is null.
 */
public record SecurityEvent(
        String id,
        Instant startTime,
        Instant endTime,
        SignalSource source,
        EventType type,
        SignalSeverity severity,
        String packageName,
        String summary,
        List<SecuritySignal> signals,
        Map<String, String> metadata,
        boolean isPromoted
) {
    public SecurityEvent promoted() {
        return new SecurityEvent(id, startTime, endTime, source, type, severity, packageName,
                summary, signals, metadata, true);
    }

    public boolean hasSignal(SignalType signalType) {
        return signals.stream().anyMatch(s -> s.type() == signalType);
    }
}

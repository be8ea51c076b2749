package tech.noetzold.risk_engine.service;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Name-based UUIDs, so that the same input always yields the same signal and event ids.
 */
final class StableIds {

    private StableIds() {
    }

    static String of(String prefix, String key) {
        return UUID.nameUUIDFromBytes((prefix + ":" + key).getBytes(StandardCharsets.UTF_8)).toString();
    }
}

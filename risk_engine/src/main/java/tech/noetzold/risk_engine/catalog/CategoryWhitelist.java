package tech.noetzold.risk_engine.catalog;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_engine.model.AppCategory;
import tech.noetzold.risk_engine.model.CapabilityCluster;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Capability clusters an app of a given category legitimately needs.
 */
@Component
public class CategoryWhitelist {

    static final int ACCESSIBILITY_TOOL_MIN_TRUST = 40;

    private static final Map<AppCategory, Set<CapabilityCluster>> EXPECTED = new EnumMap<>(AppCategory.class);

    static {
        for (AppCategory category : AppCategory.values()) {
            EXPECTED.put(category, EnumSet.noneOf(CapabilityCluster.class));
        }
        EXPECTED.put(AppCategory.PHONE_DIALER, EnumSet.of(CapabilityCluster.SMS, CapabilityCluster.CALL_LOG));
        EXPECTED.put(AppCategory.SYSTEM_TELECOM, EnumSet.of(CapabilityCluster.SMS, CapabilityCluster.CALL_LOG));
        EXPECTED.put(AppCategory.SYSTEM_MESSAGING, EnumSet.of(CapabilityCluster.SMS));
        EXPECTED.put(AppCategory.SYSTEM_CONNECTIVITY, EnumSet.of(CapabilityCluster.VPN));
        EXPECTED.put(AppCategory.VPN, EnumSet.of(CapabilityCluster.VPN));
        EXPECTED.put(AppCategory.SECURITY, EnumSet.of(CapabilityCluster.DEVICE_ADMIN, CapabilityCluster.VPN));
        EXPECTED.put(AppCategory.LAUNCHER, EnumSet.of(CapabilityCluster.NOTIFICATION_LISTENER));
        EXPECTED.put(AppCategory.ACCESSIBILITY_TOOL, EnumSet.of(CapabilityCluster.ACCESSIBILITY));
        EXPECTED.put(AppCategory.NAVIGATION, EnumSet.of(CapabilityCluster.BACKGROUND_LOCATION));
        EXPECTED.put(AppCategory.FITNESS, EnumSet.of(CapabilityCluster.BACKGROUND_LOCATION));
    }

    public boolean isExpected(CapabilityCluster cluster, AppCategory category, int trustScore) {
        if (category == null) return false;
        if (!EXPECTED.get(category).contains(cluster)) return false;
        // accessibility tools only earn the pass when their provenance is not low trust
        if (category == AppCategory.ACCESSIBILITY_TOOL && cluster == CapabilityCluster.ACCESSIBILITY) {
            return trustScore >= ACCESSIBILITY_TOOL_MIN_TRUST;
        }
        return true;
    }

    public boolean isExpected(CapabilityCluster cluster, AppCategory category) {
        return isExpected(cluster, category, 100);
    }
}

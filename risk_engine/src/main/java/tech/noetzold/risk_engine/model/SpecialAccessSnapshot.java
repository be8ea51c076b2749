package tech.noetzold.risk_engine.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Real enabled state of the toggleable special-access services for one package.
 */
public record SpecialAccessSnapshot(
        String packageName,
        boolean accessibilityEnabled,
        boolean notificationListenerEnabled,
        boolean deviceAdminEnabled,
        boolean isDefaultSms,
        boolean isDefaultDialer,
        boolean overlayEnabled,
        boolean batteryOptimizationIgnored
) {
    public static SpecialAccessSnapshot none(String packageName) {
        return new SpecialAccessSnapshot(packageName, false, false, false, false, false, false, false);
    }

    public boolean hasAnySpecialAccess() {
        return accessibilityEnabled || notificationListenerEnabled || deviceAdminEnabled
                || isDefaultSms || isDefaultDialer || overlayEnabled;
    }

    public int activeCount() {
        return activeLabels().size();
    }

    public List<String> activeLabels() {
        List<String> labels = new ArrayList<>();
        if (accessibilityEnabled) labels.add("Accessibility service");
        if (notificationListenerEnabled) labels.add("Notification access");
        if (deviceAdminEnabled) labels.add("Device admin");
        if (isDefaultSms) labels.add("Default SMS app");
        if (isDefaultDialer) labels.add("Default dialer");
        if (overlayEnabled) labels.add("Draw over other apps");
        if (batteryOptimizationIgnored) labels.add("Ignores battery optimization");
        return labels;
    }
}

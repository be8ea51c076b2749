package tech.noetzold.risk_engine.model;

import tech.noetzold.risk_engine.catalog.AndroidPermissions;

import java.util.Collection;
import java.util.Set;

public enum CapabilityCluster {
    SMS("SMS access", true, Set.of(
            AndroidPermissions.READ_SMS, AndroidPermissions.SEND_SMS, AndroidPermissions.RECEIVE_SMS,
            AndroidPermissions.RECEIVE_MMS, AndroidPermissions.RECEIVE_WAP_PUSH)),
    CALL_LOG("Call log access", true, Set.of(
            AndroidPermissions.READ_CALL_LOG, AndroidPermissions.WRITE_CALL_LOG,
            AndroidPermissions.PROCESS_OUTGOING_CALLS)),
    ACCESSIBILITY("Accessibility service", true, Set.of(AndroidPermissions.BIND_ACCESSIBILITY_SERVICE)),
    NOTIFICATION_LISTENER("Notification access", true,
            Set.of(AndroidPermissions.BIND_NOTIFICATION_LISTENER_SERVICE)),
    OVERLAY("Draw over other apps", true, Set.of(AndroidPermissions.SYSTEM_ALERT_WINDOW)),
    DEVICE_ADMIN("Device admin", true, Set.of(AndroidPermissions.BIND_DEVICE_ADMIN)),
    INSTALL_PACKAGES("Installs other apps", true, Set.of(
            AndroidPermissions.REQUEST_INSTALL_PACKAGES, AndroidPermissions.INSTALL_PACKAGES)),
    VPN("VPN service", true, Set.of(AndroidPermissions.BIND_VPN_SERVICE)),
    BACKGROUND_LOCATION("Background location", false, Set.of(AndroidPermissions.ACCESS_BACKGROUND_LOCATION));

    private final String label;
    private final boolean highRisk;
    private final Set<String> permissions;

    CapabilityCluster(String label, boolean highRisk, Set<String> permissions) {
        this.label = label;
        this.highRisk = highRisk;
        this.permissions = permissions;
    }

    public String label() {
        return label;
    }

    public boolean isHighRisk() {
        return highRisk;
    }

    public Set<String> permissions() {
        return permissions;
    }

    public boolean isActive(Collection<String> grantedPermissions) {
        for (String p : grantedPermissions) {
            if (p != null && permissions.contains(p)) return true;
        }
        return false;
    }

    /**
     * Clusters backed by a service the user has to switch on explicitly.
     */
    public boolean isSpecialAccessBacked() {
        return switch (this) {
            case ACCESSIBILITY, NOTIFICATION_LISTENER, DEVICE_ADMIN, OVERLAY -> true;
            case SMS, CALL_LOG, INSTALL_PACKAGES, VPN, BACKGROUND_LOCATION -> false;
        };
    }

    public boolean isEnabledIn(SpecialAccessSnapshot snapshot) {
        return switch (this) {
            case ACCESSIBILITY -> snapshot.accessibilityEnabled();
            case NOTIFICATION_LISTENER -> snapshot.notificationListenerEnabled();
            case DEVICE_ADMIN -> snapshot.deviceAdminEnabled();
            case OVERLAY -> snapshot.overlayEnabled();
            case SMS, CALL_LOG, INSTALL_PACKAGES, VPN, BACKGROUND_LOCATION -> true;
        };
    }
}

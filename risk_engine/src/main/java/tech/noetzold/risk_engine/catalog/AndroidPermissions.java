package tech.noetzold.risk_engine.catalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class AndroidPermissions {

    public static final String READ_SMS = "android.permission.READ_SMS";
    public static final String SEND_SMS = "android.permission.SEND_SMS";
    public static final String RECEIVE_SMS = "android.permission.RECEIVE_SMS";
    public static final String RECEIVE_MMS = "android.permission.RECEIVE_MMS";
    public static final String RECEIVE_WAP_PUSH = "android.permission.RECEIVE_WAP_PUSH";
    public static final String READ_CALL_LOG = "android.permission.READ_CALL_LOG";
    public static final String WRITE_CALL_LOG = "android.permission.WRITE_CALL_LOG";
    public static final String PROCESS_OUTGOING_CALLS = "android.permission.PROCESS_OUTGOING_CALLS";
    public static final String CALL_PHONE = "android.permission.CALL_PHONE";
    public static final String READ_PHONE_STATE = "android.permission.READ_PHONE_STATE";
    public static final String READ_CONTACTS = "android.permission.READ_CONTACTS";
    public static final String WRITE_CONTACTS = "android.permission.WRITE_CONTACTS";
    public static final String CAMERA = "android.permission.CAMERA";
    public static final String RECORD_AUDIO = "android.permission.RECORD_AUDIO";
    public static final String ACCESS_FINE_LOCATION = "android.permission.ACCESS_FINE_LOCATION";
    public static final String ACCESS_COARSE_LOCATION = "android.permission.ACCESS_COARSE_LOCATION";
    public static final String ACCESS_BACKGROUND_LOCATION = "android.permission.ACCESS_BACKGROUND_LOCATION";
    public static final String BODY_SENSORS = "android.permission.BODY_SENSORS";
    public static final String ACTIVITY_RECOGNITION = "android.permission.ACTIVITY_RECOGNITION";
    public static final String READ_CALENDAR = "android.permission.READ_CALENDAR";
    public static final String USE_BIOMETRIC = "android.permission.USE_BIOMETRIC";
    public static final String BIND_ACCESSIBILITY_SERVICE = "android.permission.BIND_ACCESSIBILITY_SERVICE";
    public static final String BIND_NOTIFICATION_LISTENER_SERVICE = "android.permission.BIND_NOTIFICATION_LISTENER_SERVICE";
    public static final String BIND_DEVICE_ADMIN = "android.permission.BIND_DEVICE_ADMIN";
    public static final String BIND_VPN_SERVICE = "android.permission.BIND_VPN_SERVICE";
    public static final String BIND_INPUT_METHOD = "android.permission.BIND_INPUT_METHOD";
    public static final String SYSTEM_ALERT_WINDOW = "android.permission.SYSTEM_ALERT_WINDOW";
    public static final String REQUEST_INSTALL_PACKAGES = "android.permission.REQUEST_INSTALL_PACKAGES";
    public static final String INSTALL_PACKAGES = "android.permission.INSTALL_PACKAGES";
    public static final String RECEIVE_BOOT_COMPLETED = "android.permission.RECEIVE_BOOT_COMPLETED";

    /**
     * Permissions whose appearance between two scans is reported as a drift anomaly.
     */
    public static final Set<String> HIGH_RISK_PERMISSIONS = Set.of(
            READ_SMS, SEND_SMS, RECEIVE_SMS,
            READ_CALL_LOG, WRITE_CALL_LOG, PROCESS_OUTGOING_CALLS,
            BIND_ACCESSIBILITY_SERVICE, BIND_NOTIFICATION_LISTENER_SERVICE,
            BIND_DEVICE_ADMIN, BIND_VPN_SERVICE,
            SYSTEM_ALERT_WINDOW, REQUEST_INSTALL_PACKAGES, INSTALL_PACKAGES,
            ACCESS_BACKGROUND_LOCATION
    );

    public static boolean isHighRisk(String permission) {
        return permission != null && HIGH_RISK_PERMISSIONS.contains(permission);
    }

    /**
     * Privacy-sensitive permissions tracked for display only. Keyed by permission, valued by label.
     */
    public static final Map<String, String> PRIVACY_PERMISSIONS;

    static {
        Map<String, String> privacy = new LinkedHashMap<>();
        privacy.put(CAMERA, "Camera");
        privacy.put(RECORD_AUDIO, "Microphone");
        privacy.put(ACCESS_FINE_LOCATION, "Precise location");
        privacy.put(ACCESS_COARSE_LOCATION, "Approximate location");
        privacy.put(READ_CONTACTS, "Contacts");
        privacy.put(READ_CALENDAR, "Calendar");
        privacy.put(BODY_SENSORS, "Body sensors");
        privacy.put(ACTIVITY_RECOGNITION, "Physical activity");
        privacy.put(READ_PHONE_STATE, "Phone state");
        PRIVACY_PERMISSIONS = Map.copyOf(privacy);
    }

    private AndroidPermissions() {}
}

package tech.noetzold.risk_engine.model;

import tech.noetzold.risk_engine.catalog.AndroidPermissions;

import java.util.Set;

import static tech.noetzold.risk_engine.catalog.AndroidPermissions.*;

public enum AppCategory {
    SYSTEM_TELECOM(Set.of(READ_SMS, SEND_SMS, RECEIVE_SMS, READ_CALL_LOG, WRITE_CALL_LOG,
            CALL_PHONE, READ_PHONE_STATE, READ_CONTACTS, PROCESS_OUTGOING_CALLS)),
    SYSTEM_MESSAGING(Set.of(READ_SMS, SEND_SMS, RECEIVE_SMS, RECEIVE_MMS, RECEIVE_WAP_PUSH,
            READ_CONTACTS, READ_PHONE_STATE)),
    SYSTEM_FRAMEWORK(Set.of()),
    SYSTEM_CONNECTIVITY(Set.of(BIND_VPN_SERVICE, ACCESS_FINE_LOCATION, ACCESS_COARSE_LOCATION,
            READ_PHONE_STATE)),
    VPN(Set.of(BIND_VPN_SERVICE)),
    BANKING(Set.of(AndroidPermissions.CAMERA, ACCESS_FINE_LOCATION, USE_BIOMETRIC)),
    MESSAGING(Set.of(AndroidPermissions.CAMERA, RECORD_AUDIO, READ_CONTACTS, ACCESS_FINE_LOCATION)),
    SOCIAL(Set.of(AndroidPermissions.CAMERA, RECORD_AUDIO, READ_CONTACTS, ACCESS_FINE_LOCATION)),
    NAVIGATION(Set.of(ACCESS_FINE_LOCATION, ACCESS_COARSE_LOCATION, ACCESS_BACKGROUND_LOCATION)),
    CAMERA(Set.of(AndroidPermissions.CAMERA, RECORD_AUDIO, ACCESS_FINE_LOCATION)),
    FITNESS(Set.of(ACCESS_FINE_LOCATION, ACCESS_BACKGROUND_LOCATION, BODY_SENSORS, ACTIVITY_RECOGNITION)),
    BROWSER(Set.of(AndroidPermissions.CAMERA, RECORD_AUDIO, ACCESS_FINE_LOCATION)),
    PHONE_DIALER(Set.of(READ_CONTACTS, WRITE_CONTACTS, READ_CALL_LOG, WRITE_CALL_LOG, READ_SMS,
            SEND_SMS, CALL_PHONE, READ_PHONE_STATE, RECORD_AUDIO, AndroidPermissions.CAMERA)),
    SECURITY(Set.of(BIND_DEVICE_ADMIN, BIND_VPN_SERVICE)),
    LAUNCHER(Set.of(BIND_NOTIFICATION_LISTENER_SERVICE, READ_CONTACTS)),
    ACCESSIBILITY_TOOL(Set.of(BIND_ACCESSIBILITY_SERVICE)),
    GAME(Set.of()),
    UTILITY(Set.of()),
    KEYBOARD(Set.of(BIND_INPUT_METHOD, RECORD_AUDIO)),
    OTHER(Set.of());

    private final Set<String> expectedPermissions;

    AppCategory(Set<String> expectedPermissions) {
        this.expectedPermissions = expectedPermissions;
    }

    public Set<String> expectedPermissions() {
        return expectedPermissions;
    }

    public boolean expects(String permission) {
        return permission != null && expectedPermissions.contains(permission);
    }
}

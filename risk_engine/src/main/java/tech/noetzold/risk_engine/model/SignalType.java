package tech.noetzold.risk_engine.model;

public enum SignalType {
    // app drift
    CERT_CHANGE,
    VERSION_ROLLBACK,
    INSTALLER_CHANGE,
    HIGH_RISK_PERM_ADDED,
    SPECIAL_ACCESS_ENABLED,
    SPECIAL_ACCESS_DISABLED,
    EXPORTED_SURFACE_CHANGE,
    NEW_APP_INSTALLED,
    APP_REMOVED,
    SUSPICIOUS_NATIVE_LIB,
    DEBUG_SIGNATURE,
    COMBO_DETECTED,

    // device configuration
    USER_CA_CERT_ADDED,
    USER_CA_CERT_REMOVED,
    PRIVATE_DNS_CHANGED,
    VPN_STATE_CHANGED,
    WIFI_PROXY_DETECTED,
    UNKNOWN_ACCESSIBILITY_SERVICE,
    NOTIFICATION_LISTENER_ADDED,
    DEFAULT_APP_CHANGED,
    ROOT_DETECTED,
    BOOTLOADER_UNLOCKED,
    DEVELOPER_OPTIONS_ENABLED,
    USB_DEBUGGING_ENABLED,
    UNKNOWN_SOURCES_ENABLED,

    // install timeline
    DYNAMIC_CODE_LOADING,
    FRESH_INSTALL_RISKY_PERM,
    NETWORK_AFTER_INSTALL,
    STAGED_PAYLOAD_PATTERN,
    BOOT_PERSISTENCE,
    POST_INSTALL_PERMISSION_ESCALATION,

    // reserved for runtime telemetry
    BATTERY_DRAIN_ANOMALY,
    NETWORK_BURST_ANOMALY,
    EXCESSIVE_WAKEUPS,
    UNUSUAL_CONTEXT
}

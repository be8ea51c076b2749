package tech.noetzold.risk_engine.model;

public enum TimelineSignalType {
    FRESH_INSTALL,
    NETWORK_BURST_AFTER_INSTALL,
    SMS_ACCESS_AFTER_INSTALL,
    ACCESSIBILITY_AFTER_INSTALL,
    OVERLAY_AFTER_INSTALL,
    PERMISSION_ESCALATION,
    BOOT_PERSISTENCE,
    DYNAMIC_CODE_LOADING,
    INSTALL_PACKAGES_CAPABILITY,
    LOW_TRUST_AMPLIFIER,
    SIDELOAD_AMPLIFIER
}

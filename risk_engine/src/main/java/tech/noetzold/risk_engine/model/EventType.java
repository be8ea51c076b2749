package tech.noetzold.risk_engine.model;

public enum EventType {
    SUSPICIOUS_UPDATE,
    SUSPICIOUS_INSTALL,
    CAPABILITY_ESCALATION,
    SPECIAL_ACCESS_GRANT,
    STALKERWARE_PATTERN,
    DROPPER_PATTERN,
    OVERLAY_ATTACK_PATTERN,
    STAGED_PAYLOAD,
    LOADER_BEHAVIOR,
    CONFIG_TAMPER,
    CA_CERT_INSTALLED,
    SUSPICIOUS_VPN,
    DEVICE_COMPROMISE,
    BEHAVIORAL_ANOMALY,
    OTHER
}

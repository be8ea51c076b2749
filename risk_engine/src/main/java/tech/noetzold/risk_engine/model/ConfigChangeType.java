package tech.noetzold.risk_engine.model;

public enum ConfigChangeType {
    CA_CERT_ADDED(SignalSeverity.HIGH, SignalType.USER_CA_CERT_ADDED),
    CA_CERT_REMOVED(SignalSeverity.MEDIUM, SignalType.USER_CA_CERT_REMOVED),
    PRIVATE_DNS_CHANGED(SignalSeverity.MEDIUM, SignalType.PRIVATE_DNS_CHANGED),
    VPN_ENABLED(SignalSeverity.MEDIUM, SignalType.VPN_STATE_CHANGED),
    VPN_DISABLED(SignalSeverity.LOW, SignalType.VPN_STATE_CHANGED),
    PROXY_ENABLED(SignalSeverity.HIGH, SignalType.WIFI_PROXY_DETECTED),
    PROXY_DISABLED(SignalSeverity.LOW, SignalType.WIFI_PROXY_DETECTED),
    ACCESSIBILITY_SERVICE_ADDED(SignalSeverity.HIGH, SignalType.UNKNOWN_ACCESSIBILITY_SERVICE),
    ACCESSIBILITY_SERVICE_REMOVED(SignalSeverity.LOW, SignalType.SPECIAL_ACCESS_DISABLED),
    NOTIFICATION_LISTENER_ADDED(SignalSeverity.MEDIUM, SignalType.NOTIFICATION_LISTENER_ADDED),
    NOTIFICATION_LISTENER_REMOVED(SignalSeverity.LOW, SignalType.SPECIAL_ACCESS_DISABLED),
    DEFAULT_SMS_CHANGED(SignalSeverity.HIGH, SignalType.DEFAULT_APP_CHANGED),
    DEFAULT_DIALER_CHANGED(SignalSeverity.MEDIUM, SignalType.DEFAULT_APP_CHANGED),
    DEVELOPER_OPTIONS_ENABLED(SignalSeverity.MEDIUM, SignalType.DEVELOPER_OPTIONS_ENABLED),
    USB_DEBUGGING_ENABLED(SignalSeverity.MEDIUM, SignalType.USB_DEBUGGING_ENABLED),
    UNKNOWN_SOURCES_ENABLED(SignalSeverity.HIGH, SignalType.UNKNOWN_SOURCES_ENABLED);

    private final SignalSeverity severity;
    private final SignalType signalType;

    ConfigChangeType(SignalSeverity severity, SignalType signalType) {
        this.severity = severity;
        this.signalType = signalType;
    }

    public SignalSeverity severity() {
        return severity;
    }

    public SignalType signalType() {
        return signalType;
    }
}

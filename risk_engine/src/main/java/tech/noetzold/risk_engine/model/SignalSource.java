package tech.noetzold.risk_engine.model;

public enum SignalSource {
    APP_SCANNER,
    BASELINE,
    SPECIAL_ACCESS,
    CONFIG_BASELINE,
    TRUST_ENGINE,
    INSTALL_TIMELINE,
    DEVICE_ANALYZER
}

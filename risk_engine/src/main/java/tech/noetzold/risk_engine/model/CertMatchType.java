package tech.noetzold.risk_engine.model;

public enum CertMatchType {
    DEVELOPER_MATCH,
    APP_MATCH,
    CERT_MISMATCH,
    UNKNOWN
}

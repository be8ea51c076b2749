package tech.noetzold.risk_engine.model;

public enum AnomalyType {
    CERT_CHANGED,
    VERSION_ROLLBACK,
    VERSION_CHANGED,
    INSTALLER_CHANGED,
    PARTITION_CHANGED,
    PERMISSION_SET_CHANGED,
    HIGH_RISK_PERMISSION_ADDED,
    EXPORTED_SURFACE_INCREASED,
    NEW_SYSTEM_APP
}

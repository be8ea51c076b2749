package tech.noetzold.risk_engine.model;

public enum InstallClass {
    SYSTEM_PREINSTALLED,
    USER_INSTALLED,
    ENTERPRISE_MANAGED
}

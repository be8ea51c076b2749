package tech.noetzold.risk_engine.model;

public enum ActionCategory {
    UNINSTALL,
    DISABLE,
    REVOKE_PERMISSION,
    REVOKE_SPECIAL_ACCESS,
    CHECK_SETTINGS,
    REINSTALL_FROM_STORE,
    FACTORY_RESET,
    MONITOR,
    INFORM
}

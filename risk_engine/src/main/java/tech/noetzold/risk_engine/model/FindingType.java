package tech.noetzold.risk_engine.model;

public enum FindingType {
    DEBUG_SIGNATURE,
    SIGNATURE_MISMATCH,
    SIGNATURE_DRIFT,
    BASELINE_SIGNATURE_CHANGE,
    BASELINE_NEW_SYSTEM_APP,
    INTEGRITY_FAIL_WITH_HOOKING,
    INSTALLER_ANOMALY,
    PARTITION_ANOMALY,
    VERSION_ROLLBACK,
    HIGH_RISK_PERMISSION_ADDED,

    INSTALLER_ANOMALY_VERIFIED,
    VERSION_ROLLBACK_TRUSTED,
    EXPORTED_SURFACE_INCREASED,
    OVER_PRIVILEGED,
    SUSPICIOUS_NATIVE_LIB,
    NOT_PLAY_SIGNED,

    EXPORTED_COMPONENTS,
    OLD_TARGET_SDK,
    HIGH_RISK_CAPABILITY,
    CRITICAL_PERMISSION;

    // Exhaustive on purpose: a new constant does not compile until it is classified here.
    public Hardness hardness() {
        return switch (this) {
            case DEBUG_SIGNATURE, SIGNATURE_MISMATCH, SIGNATURE_DRIFT, BASELINE_SIGNATURE_CHANGE,
                    BASELINE_NEW_SYSTEM_APP, INTEGRITY_FAIL_WITH_HOOKING, INSTALLER_ANOMALY,
                    PARTITION_ANOMALY, VERSION_ROLLBACK, HIGH_RISK_PERMISSION_ADDED -> Hardness.HARD;
            case INSTALLER_ANOMALY_VERIFIED, VERSION_ROLLBACK_TRUSTED, EXPORTED_SURFACE_INCREASED,
                    OVER_PRIVILEGED, SUSPICIOUS_NATIVE_LIB, NOT_PLAY_SIGNED -> Hardness.SOFT;
            case EXPORTED_COMPONENTS, OLD_TARGET_SDK, HIGH_RISK_CAPABILITY,
                    CRITICAL_PERMISSION -> Hardness.WEAK_SIGNAL;
        };
    }

    /**
     * Hygiene findings forced to NONE under the SYSTEM policy profile.
     */
    public boolean isSystemHygiene() {
        return switch (this) {
            case OLD_TARGET_SDK, OVER_PRIVILEGED, EXPORTED_COMPONENTS, NOT_PLAY_SIGNED,
                    INSTALLER_ANOMALY_VERIFIED -> true;
            default -> false;
        };
    }

    /**
     * Findings that only exist because the package drifted from its stored baseline.
     */
    public boolean isBaselineDelta() {
        return switch (this) {
            case BASELINE_SIGNATURE_CHANGE, BASELINE_NEW_SYSTEM_APP, VERSION_ROLLBACK,
                    VERSION_ROLLBACK_TRUSTED, HIGH_RISK_PERMISSION_ADDED, EXPORTED_SURFACE_INCREASED,
                    INSTALLER_ANOMALY, INSTALLER_ANOMALY_VERIFIED, PARTITION_ANOMALY,
                    SIGNATURE_DRIFT -> true;
            default -> false;
        };
    }
}

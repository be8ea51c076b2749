package tech.noetzold.risk_engine.model;

public enum PolicyProfile {
    SYSTEM(5),
    USER(1);

    private final int infoThreshold;

    PolicyProfile(int infoThreshold) {
        this.infoThreshold = infoThreshold;
    }

    /** Weighted finding sum at which a verdict reaches INFO. */
    public int infoThreshold() {
        return infoThreshold;
    }

    public static PolicyProfile forInstallClass(InstallClass installClass) {
        return switch (installClass) {
            case SYSTEM_PREINSTALLED, ENTERPRISE_MANAGED -> SYSTEM;
            case USER_INSTALLED -> USER;
        };
    }
}

package tech.noetzold.risk_engine.model;

public enum InstallerType {
    PLAY_STORE,
    SYSTEM_INSTALLER,
    SAMSUNG_STORE,
    HUAWEI_APPGALLERY,
    AMAZON_APPSTORE,
    MDM_INSTALLER,
    SIDELOADED,
    UNKNOWN;

    /**
     * Store and platform installers that a legitimate install is expected to come from.
     */
    public boolean isExpected() {
        return switch (this) {
            case PLAY_STORE, SYSTEM_INSTALLER, SAMSUNG_STORE, HUAWEI_APPGALLERY,
                    AMAZON_APPSTORE, MDM_INSTALLER -> true;
            case SIDELOADED, UNKNOWN -> false;
        };
    }
}

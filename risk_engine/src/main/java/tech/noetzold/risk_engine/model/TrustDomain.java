package tech.noetzold.risk_engine.model;

/**
 * Signing authority a package is expected to belong to, derived from where it is installed
 * rather than from the certificate it carries.
 */
public enum TrustDomain {
    PLAY_SIGNED,
    PLATFORM_SIGNED,
    APEX_MODULE,
    OEM_VENDOR,
    UNKNOWN
}

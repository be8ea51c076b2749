package tech.noetzold.risk_engine.model;

public record DeviceIntegrityEvidence(
        boolean isRooted,
        VerifiedBootState verifiedBootState
) {
    public static DeviceIntegrityEvidence unknown() {
        return new DeviceIntegrityEvidence(false, VerifiedBootState.UNKNOWN);
    }
}

package tech.noetzold.risk_engine.model;

import java.util.List;

public record TrustEvidence(
        String packageName,
        String certSha256,
        CertMatchResult certMatch,
        InstallerInfo installerInfo,
        SystemAppInfo systemAppInfo,
        SigningLineageInfo signingLineage,
        DeviceIntegrityEvidence deviceIntegrity,
        int trustScore,
        TrustLevel trustLevel,
        List<TrustReason> reasons
) {
    public InstallerType installerType() {
        return installerInfo != null && installerInfo.installerType() != null
                ? installerInfo.installerType()
                : InstallerType.UNKNOWN;
    }

    public boolean isSideloaded() {
        return installerType() == InstallerType.SIDELOADED;
    }

    public boolean isLowTrust() {
        return trustScore < 40;
    }

    public boolean isHighTrust() {
        return trustScore >= 70;
    }
}

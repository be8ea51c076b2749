package tech.noetzold.risk_engine.model;

public record CertMatchResult(
        CertMatchType matchType,
        String matchedDeveloper,
        String currentCertDigest
) {
    public static CertMatchResult unknown(String digest) {
        return new CertMatchResult(CertMatchType.UNKNOWN, null, digest);
    }
}

package tech.noetzold.risk_engine.model;

public record SystemAppInfo(
        boolean isSystemApp,
        boolean isPrivilegedApp,
        boolean isUpdatedSystemApp,
        AppPartition partition,
        boolean isPlatformSigned,
        TrustDomain trustDomain
) {}

package tech.noetzold.risk_engine.model;

public record InstallerInfo(
        String installerPackage,
        InstallerType installerType,
        boolean isExpectedInstaller
) {}

package tech.noetzold.risk_engine.model;

public enum AppPartition {
    SYSTEM,
    VENDOR,
    PRODUCT,
    DATA,
    UNKNOWN;

    public static AppPartition fromPath(String apkPath) {
        if (apkPath == null || apkPath.isBlank()) return UNKNOWN;
        if (apkPath.startsWith("/system/")) return SYSTEM;
        if (apkPath.startsWith("/vendor/")) return VENDOR;
        if (apkPath.startsWith("/product/")) return PRODUCT;
        if (apkPath.startsWith("/data/")) return DATA;
        return UNKNOWN;
    }

    public boolean isSystemPartition() {
        return this == SYSTEM || this == VENDOR || this == PRODUCT;
    }
}

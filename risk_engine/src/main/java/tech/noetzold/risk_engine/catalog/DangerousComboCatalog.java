package tech.noetzold.risk_engine.catalog;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_engine.model.DangerousCombo;
import tech.noetzold.risk_engine.model.RiskLevel;

import java.util.EnumSet;
import java.util.List;

import static tech.noetzold.risk_engine.model.CapabilityCluster.*;

@Component
public class DangerousComboCatalog {

    public static final String OVERLAY_ACCESSIBILITY_SIDELOAD = "Overlay + accessibility from sideloaded app";
    public static final String DROPPER = "Dropper: accessibility + install packages + low trust";
    public static final String SIDELOAD_DEBUG_SMS = "Suspicious SMS access: sideloaded debug build";
    public static final String SMS_CALL_LOG_LOW_TRUST = "Low trust + SMS + call log";
    public static final String STALKERWARE_SIDELOADED = "Stalkerware pattern from sideloaded app";
    public static final String STALKERWARE = "Stalkerware pattern: accessibility + notification listener";
    public static final String SIDELOADED_VPN = "Sideloaded VPN with low trust";
    public static final String SIDELOADED_INSTALLER = "Sideloaded installer of further packages";
    public static final String NOTIFICATION_OVERLAY = "Notification access + overlay (OTP phishing)";
    public static final String DEVICE_ADMIN_ACCESSIBILITY = "Device admin + accessibility (device takeover)";

    private static final List<DangerousCombo> COMBOS = List.of(
            new DangerousCombo(OVERLAY_ACCESSIBILITY_SIDELOAD,
                    "Can read the screen and draw fake input over other apps",
                    EnumSet.of(ACCESSIBILITY, OVERLAY), false, true, false, true, RiskLevel.CRITICAL),
            new DangerousCombo(DROPPER,
                    "Can silently install further apps while driving the UI",
                    EnumSet.of(ACCESSIBILITY, INSTALL_PACKAGES), true, false, false, true, RiskLevel.CRITICAL),
            new DangerousCombo(SIDELOAD_DEBUG_SMS,
                    "Debug-signed sideloaded build reading SMS",
                    EnumSet.of(SMS), false, true, true, true, RiskLevel.CRITICAL),
            new DangerousCombo(SMS_CALL_LOG_LOW_TRUST,
                    "Reads messages and call history without trusted provenance",
                    EnumSet.of(SMS, CALL_LOG), true, false, false, true, RiskLevel.HIGH),
            new DangerousCombo(STALKERWARE_SIDELOADED,
                    "Monitors screen content and notifications, installed outside a store",
                    EnumSet.of(ACCESSIBILITY, NOTIFICATION_LISTENER), true, true, false, true, RiskLevel.CRITICAL),
            new DangerousCombo(STALKERWARE,
                    "Monitors screen content and notifications",
                    EnumSet.of(ACCESSIBILITY, NOTIFICATION_LISTENER), true, false, false, true, RiskLevel.HIGH),
            new DangerousCombo(SIDELOADED_VPN,
                    "Routes all traffic through an untrusted sideloaded VPN",
                    EnumSet.of(VPN), true, true, false, false, RiskLevel.HIGH),
            new DangerousCombo(SIDELOADED_INSTALLER,
                    "Sideloaded app able to install further packages",
                    EnumSet.of(INSTALL_PACKAGES), true, true, false, true, RiskLevel.HIGH),
            new DangerousCombo(NOTIFICATION_OVERLAY,
                    "Can read one-time codes and overlay login screens",
                    EnumSet.of(NOTIFICATION_LISTENER, OVERLAY), true, false, false, true, RiskLevel.HIGH),
            new DangerousCombo(DEVICE_ADMIN_ACCESSIBILITY,
                    "Can lock the device and block its own removal",
                    EnumSet.of(DEVICE_ADMIN, ACCESSIBILITY), true, false, false, true, RiskLevel.CRITICAL)
    );

    public List<DangerousCombo> combos() {
        return COMBOS;
    }
}

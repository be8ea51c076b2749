package tech.noetzold.risk_engine.model;

import lombok.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Set;
import java.util.TreeSet;

/**
 * Device configuration as read by the settings collaborator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigSnapshot {
    private Instant timestamp;
    private Set<String> userCaCertFingerprints;
    private String privateDnsMode;
    private String privateDnsHostname;
    private boolean vpnActive;
    private String vpnPackage;
    private String globalProxyHost;
    private String globalProxyPort;
    private Set<String> enabledAccessibilityServices;
    private Set<String> enabledNotificationListeners;
    private String defaultSmsApp;
    private String defaultDialerApp;
    private boolean developerOptionsEnabled;
    private boolean usbDebuggingEnabled;
    private boolean unknownSourcesEnabled;

    public Set<String> caCertsOrEmpty() {
        return sortedOrEmpty(userCaCertFingerprints);
    }

    public Set<String> accessibilityOrEmpty() {
        return sortedOrEmpty(enabledAccessibilityServices);
    }

    public Set<String> notificationListenersOrEmpty() {
        return sortedOrEmpty(enabledNotificationListeners);
    }

    private static Set<String> sortedOrEmpty(Set<String> values) {
        Set<String> sorted = new TreeSet<>();
        if (values == null) return sorted;
        for (String v : values) {
            if (v != null && !v.isBlank()) sorted.add(v);
        }
        return sorted;
    }

    public boolean hasProxy() {
        return globalProxyHost != null && !globalProxyHost.isBlank();
    }

    /**
     * SHA-256 over a canonical, order-independent rendering of the snapshot.
     */
    public String configHash() {
        String canonical = String.join("|",
                "ca=" + String.join(",", caCertsOrEmpty()),
                "dns=" + privateDnsMode + ":" + privateDnsHostname,
                "vpn=" + vpnActive + ":" + vpnPackage,
                "proxy=" + globalProxyHost + ":" + globalProxyPort,
                "a11y=" + String.join(",", accessibilityOrEmpty()),
                "nl=" + String.join(",", notificationListenersOrEmpty()),
                "sms=" + defaultSmsApp,
                "dialer=" + defaultDialerApp,
                "dev=" + developerOptionsEnabled,
                "usb=" + usbDebuggingEnabled,
                "unk=" + unknownSourcesEnabled);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package tech.noetzold.risk_engine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.risk_engine.model.*;

import java.time.Instant;
import java.util.*;

/**
 * Detects drift in device-wide security configuration between two snapshots.
 */
@Slf4j
@Service
public class ConfigBaselineEngine {

    private static final int FINGERPRINT_PREVIEW = 16;

    public ConfigDelta compareSnapshots(ConfigSnapshot previous, ConfigSnapshot current) {
        if (current == null) {
            return new ConfigDelta(previous != null ? previous.configHash() : null, null, List.of());
        }
        String newHash = current.configHash();
        if (previous == null) {
            return new ConfigDelta(null, newHash, List.of());
        }
        String oldHash = previous.configHash();
        if (oldHash.equals(newHash)) {
            return new ConfigDelta(oldHash, newHash, List.of());
        }

        List<ConfigChange> changes = new ArrayList<>();

        for (String cert : added(previous.caCertsOrEmpty(), current.caCertsOrEmpty())) {
            changes.add(change(ConfigChangeType.CA_CERT_ADDED, "User CA certificate added", null, preview(cert), null));
        }
        for (String cert : added(current.caCertsOrEmpty(), previous.caCertsOrEmpty())) {
            changes.add(change(ConfigChangeType.CA_CERT_REMOVED, "User CA certificate removed", preview(cert), null, null));
        }

        if (!Objects.equals(previous.getPrivateDnsMode(), current.getPrivateDnsMode())
                || !Objects.equals(previous.getPrivateDnsHostname(), current.getPrivateDnsHostname())) {
            changes.add(change(ConfigChangeType.PRIVATE_DNS_CHANGED, "Private DNS settings changed",
                    previous.getPrivateDnsMode() + ":" + previous.getPrivateDnsHostname(),
                    current.getPrivateDnsMode() + ":" + current.getPrivateDnsHostname(), null));
        }

        if (!previous.isVpnActive() && current.isVpnActive()) {
            changes.add(change(ConfigChangeType.VPN_ENABLED, "VPN activated", null, current.getVpnPackage(),
                    current.getVpnPackage()));
        } else if (previous.isVpnActive() && !current.isVpnActive()) {
            changes.add(change(ConfigChangeType.VPN_DISABLED, "VPN deactivated", previous.getVpnPackage(), null,
                    previous.getVpnPackage()));
        }

        if (!previous.hasProxy() && current.hasProxy()) {
            changes.add(change(ConfigChangeType.PROXY_ENABLED, "Global proxy configured", null,
                    proxy(current), null));
        } else if (previous.hasProxy() && !current.hasProxy()) {
            changes.add(change(ConfigChangeType.PROXY_DISABLED, "Global proxy removed", proxy(previous), null, null));
        }

        for (String pkg : added(previous.accessibilityOrEmpty(), current.accessibilityOrEmpty())) {
            changes.add(change(ConfigChangeType.ACCESSIBILITY_SERVICE_ADDED,
                    "New accessibility service enabled: " + pkg, null, pkg, pkg));
        }
        for (String pkg : added(current.accessibilityOrEmpty(), previous.accessibilityOrEmpty())) {
            changes.add(change(ConfigChangeType.ACCESSIBILITY_SERVICE_REMOVED,
                    "Accessibility service disabled: " + pkg, pkg, null, pkg));
        }

        for (String pkg : added(previous.notificationListenersOrEmpty(), current.notificationListenersOrEmpty())) {
            changes.add(change(ConfigChangeType.NOTIFICATION_LISTENER_ADDED,
                    "New notification listener enabled: " + pkg, null, pkg, pkg));
        }
        for (String pkg : added(current.notificationListenersOrEmpty(), previous.notificationListenersOrEmpty())) {
            changes.add(change(ConfigChangeType.NOTIFICATION_LISTENER_REMOVED,
                    "Notification listener disabled: " + pkg, pkg, null, pkg));
        }

        if (!Objects.equals(previous.getDefaultSmsApp(), current.getDefaultSmsApp())) {
            changes.add(change(ConfigChangeType.DEFAULT_SMS_CHANGED, "Default SMS app changed",
                    previous.getDefaultSmsApp(), current.getDefaultSmsApp(), current.getDefaultSmsApp()));
        }
        if (!Objects.equals(previous.getDefaultDialerApp(), current.getDefaultDialerApp())) {
            changes.add(change(ConfigChangeType.DEFAULT_DIALER_CHANGED, "Default dialer changed",
                    previous.getDefaultDialerApp(), current.getDefaultDialerApp(), current.getDefaultDialerApp()));
        }

        // switching these off only reduces exposure
        if (!previous.isDeveloperOptionsEnabled() && current.isDeveloperOptionsEnabled()) {
            changes.add(change(ConfigChangeType.DEVELOPER_OPTIONS_ENABLED, "Developer options enabled",
                    "false", "true", null));
        }
        if (!previous.isUsbDebuggingEnabled() && current.isUsbDebuggingEnabled()) {
            changes.add(change(ConfigChangeType.USB_DEBUGGING_ENABLED, "USB debugging enabled",
                    "false", "true", null));
        }
        if (!previous.isUnknownSourcesEnabled() && current.isUnknownSourcesEnabled()) {
            changes.add(change(ConfigChangeType.UNKNOWN_SOURCES_ENABLED, "Install from unknown sources enabled",
                    "false", "true", null));
        }

        log.info("Config drift detected: {} change(s), {} -> {}", changes.size(), shortHash(oldHash), shortHash(newHash));
        return new ConfigDelta(oldHash, newHash, List.copyOf(changes));
    }

    public List<SecuritySignal> changesToSignals(ConfigDelta delta, Instant now) {
        List<SecuritySignal> signals = new ArrayList<>();
        for (int i = 0; i < delta.changes().size(); i++) {
            ConfigChange change = delta.changes().get(i);
            Map<String, String> details = new LinkedHashMap<>();
            if (change.oldValue() != null) details.put("old", change.oldValue());
            if (change.newValue() != null) details.put("new", change.newValue());
            signals.add(new SecuritySignal(
                    StableIds.of("signal", "config:" + delta.newHash() + ":" + i + ":" + change.type()),
                    now,
                    SignalSource.CONFIG_BASELINE,
                    change.type().signalType(),
                    change.severity(),
                    change.relatedPackage(),
                    change.description(),
                    Collections.unmodifiableMap(details)
            ));
        }
        return signals;
    }

    private static ConfigChange change(ConfigChangeType type, String description,
                                       String oldValue, String newValue, String relatedPackage) {
        return new ConfigChange(type, type.severity(), description, oldValue, newValue, relatedPackage);
    }

    private static List<String> added(Set<String> before, Set<String> after) {
        TreeSet<String> result = new TreeSet<>(after);
        result.removeAll(before);
        return List.copyOf(result);
    }

    private static String preview(String fingerprint) {
        return fingerprint.length() > FINGERPRINT_PREVIEW
                ? fingerprint.substring(0, FINGERPRINT_PREVIEW) + "..."
                : fingerprint;
    }

    private static String proxy(ConfigSnapshot snapshot) {
        return snapshot.getGlobalProxyPort() != null
                ? snapshot.getGlobalProxyHost() + ":" + snapshot.getGlobalProxyPort()
                : snapshot.getGlobalProxyHost();
    }

    private static String shortHash(String hash) {
        return hash == null ? "-" : hash.substring(0, Math.min(8, hash.length()));
    }
}

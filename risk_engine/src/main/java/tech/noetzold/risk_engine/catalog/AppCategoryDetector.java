package tech.noetzold.risk_engine.catalog;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_engine.model.AppCategory;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Keyword based category detection. Rules are evaluated in order and the first hit wins.
 */
@Component
public class AppCategoryDetector {

    private record Rule(AppCategory category, Set<String> exactPackages, List<String> keywords) {
        boolean matches(String pkg, String name) {
            if (exactPackages.contains(pkg)) return true;
            for (String k : keywords) {
                if (pkg.contains(k) || name.contains(k)) return true;
            }
            return false;
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule(AppCategory.SYSTEM_TELECOM,
                    Set.of("com.android.phone", "com.android.server.telecom"),
                    List.of("telecom", "telephony", "carrierservices", "carrier", "simappdiag")),
            new Rule(AppCategory.SYSTEM_MESSAGING,
                    Set.of("com.android.mms", "com.google.android.apps.messaging"),
                    List.of()),
            new Rule(AppCategory.SYSTEM_FRAMEWORK,
                    Set.of("android", "com.android.systemui", "com.android.providers.settings"),
                    List.of("setupwizard", "companiondevicemanager", "permissioncontroller", "packageinstaller")),
            new Rule(AppCategory.SYSTEM_CONNECTIVITY,
                    Set.of(),
                    List.of("bluetooth", "wifi", "tethering", "nfc", "connectivity", "networkstack")),
            new Rule(AppCategory.VPN,
                    Set.of(),
                    List.of("vpn", "wireguard", "tunnelbear", "surfshark")),
            new Rule(AppCategory.BANKING,
                    Set.of(),
                    List.of("bank", "finance", "moneta", "csob", "csas", "fio.ib")),
            new Rule(AppCategory.MESSAGING,
                    Set.of(),
                    List.of("messenger", "chat", "whatsapp", "telegram", "viber", "signal", "discord")),
            new Rule(AppCategory.SOCIAL,
                    Set.of(),
                    List.of("facebook", "instagram", "twitter", "tiktok", "snapchat", "reddit")),
            new Rule(AppCategory.NAVIGATION,
                    Set.of(),
                    List.of("maps", "navigation", "waze", "sygic")),
            new Rule(AppCategory.CAMERA,
                    Set.of(),
                    List.of("camera", "photo")),
            new Rule(AppCategory.FITNESS,
                    Set.of(),
                    List.of("fitness", "health", "sport", "strava", "fitbit")),
            new Rule(AppCategory.BROWSER,
                    Set.of(),
                    List.of("browser", "chrome", "firefox", "brave", "opera", "duckduckgo", "webview")),
            new Rule(AppCategory.PHONE_DIALER,
                    Set.of(),
                    List.of("dialer", "contacts", "incallui", "phone")),
            new Rule(AppCategory.SECURITY,
                    Set.of(),
                    List.of("security", "antivirus", "malware", "lookout")),
            new Rule(AppCategory.LAUNCHER,
                    Set.of(),
                    List.of("launcher")),
            new Rule(AppCategory.ACCESSIBILITY_TOOL,
                    Set.of(),
                    List.of("accessibility", "talkback")),
            new Rule(AppCategory.KEYBOARD,
                    Set.of(),
                    List.of("keyboard", "inputmethod", "gboard", "swiftkey")),
            new Rule(AppCategory.GAME,
                    Set.of(),
                    List.of("game")),
            new Rule(AppCategory.UTILITY,
                    Set.of(),
                    List.of("calculator", "flashlight", "compass", "barcode", "clock", "alarm",
                            "timer", "memo", "todo", "ruler"))
    );

    public AppCategory detect(String packageName, String appName, Collection<String> requestedPermissions) {
        String pkg = packageName == null ? "" : packageName.toLowerCase();
        String name = appName == null ? "" : appName.toLowerCase();

        if ((pkg.startsWith("com.android") || pkg.startsWith("com.google.android")) && pkg.contains("messaging")) {
            return AppCategory.SYSTEM_MESSAGING;
        }
        for (Rule rule : RULES) {
            if (rule.matches(pkg, name)) return rule.category();
        }
        return fromPermissions(requestedPermissions);
    }

    private AppCategory fromPermissions(Collection<String> permissions) {
        if (permissions == null || permissions.isEmpty()) return AppCategory.OTHER;
        if (permissions.contains(AndroidPermissions.BIND_VPN_SERVICE)) return AppCategory.VPN;
        if (permissions.contains(AndroidPermissions.BIND_INPUT_METHOD)) return AppCategory.KEYBOARD;
        if (permissions.contains(AndroidPermissions.BIND_ACCESSIBILITY_SERVICE)
                && permissions.stream().filter(AndroidPermissions::isHighRisk).count() == 1) {
            return AppCategory.ACCESSIBILITY_TOOL;
        }
        return AppCategory.OTHER;
    }
}

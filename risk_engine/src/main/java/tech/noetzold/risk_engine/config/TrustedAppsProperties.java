package tech.noetzold.risk_engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import tech.noetzold.risk_engine.model.TrustDomain;

import java.util.ArrayList;
import java.util.List;

/**
 * Signing certificates the engine may trust, bound from {@code risk-engine.trusted-apps}.
 * Digests are hex SHA-256 fingerprints, colons allowed. Empty unless configured.
 */
@Data
@ConfigurationProperties(prefix = "risk-engine.trusted-apps")
public class TrustedAppsProperties {

    private List<Developer> developers = new ArrayList<>();

    /** Per-package pins. A pin wins over a developer entry covering the same package. */
    private List<Pin> pins = new ArrayList<>();

    @Data
    public static class Developer {
        private String name;
        private List<String> certDigests = new ArrayList<>();
        private List<String> packagePrefixes = new ArrayList<>();
        private TrustDomain domain = TrustDomain.PLAY_SIGNED;
    }

    @Data
    public static class Pin {
        private String packageName;
        private List<String> certDigests = new ArrayList<>();
    }
}

package tech.noetzold.risk_engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.risk_engine.catalog.TrustedAppsCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Configuration
@EnableConfigurationProperties(TrustedAppsProperties.class)
public class TrustedAppsConfig {

    @Bean
    public TrustedAppsCatalog trustedAppsCatalog(TrustedAppsProperties properties) {
        List<TrustedAppsCatalog.DeveloperEntry> developers = properties.getDevelopers().stream()
                .filter(d -> d.getName() != null && !d.getCertDigests().isEmpty() && !d.getPackagePrefixes().isEmpty())
                .map(d -> new TrustedAppsCatalog.DeveloperEntry(
                        d.getName(),
                        Set.copyOf(d.getCertDigests()),
                        Set.copyOf(d.getPackagePrefixes()),
                        d.getDomain()))
                .toList();

        Map<String, Set<String>> pins = new LinkedHashMap<>();
        for (TrustedAppsProperties.Pin pin : properties.getPins()) {
            if (pin.getPackageName() == null || pin.getCertDigests().isEmpty()) continue;
            pins.put(pin.getPackageName(), Set.copyOf(pin.getCertDigests()));
        }

        log.info("Trusted apps catalog: {} developer(s), {} pinned app(s)", developers.size(), pins.size());
        return new TrustedAppsCatalog(developers, pins);
    }
}

package de.leipzig.htwk.patentrisk.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Component
@ConfigurationProperties(prefix = "patent.cache")
@Data
public class CacheProperties {

    private boolean enabled = true;
    private Duration ttl = Duration.ofMinutes(5);
    private long maxEntries = 10_000;
}

package com.gatekeeper.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.cache.ContentFingerprinter;
import com.gatekeeper.core.cache.ValidationCache;
import com.gatekeeper.core.invoker.ProcessToolInvoker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds the stateful components explicitly so their lifecycle is owned by the
 * application context and tests can construct isolated instances.
 */
@Configuration
public class GatekeeperConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ValidationCache validationCache(GatekeeperProperties properties, Clock clock) {
        var cache = properties.getCache();
        return new ValidationCache(cache.getCapacity(), Duration.ofSeconds(cache.getTtlSeconds()),
                cache.getPurgeThreshold(), clock);
    }

    @Bean
    public ContentFingerprinter contentFingerprinter(GatekeeperProperties properties) {
        return new ContentFingerprinter(properties.getCache().getMaxFingerprintBytes());
    }

    /**
     * Relative audit directories are resolved against the project directory, so
     * every hook process for one project appends to the same files.
     */
    @Bean(destroyMethod = "close")
    public DecisionLogger decisionLogger(GatekeeperProperties properties, ObjectMapper objectMapper) {
        Path directory = Path.of(properties.getAudit().getDirectory());
        if (!directory.isAbsolute()) {
            directory = properties.resolveProjectDir().resolve(directory);
        }
        return new DecisionLogger(directory.normalize(), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public ProcessToolInvoker toolInvoker() {
        return new ProcessToolInvoker();
    }
}

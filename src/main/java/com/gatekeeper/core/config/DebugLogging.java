package com.gatekeeper.core.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Raises the {@code com.gatekeeper} loggers to DEBUG when {@code gatekeeper.debug}
 * (env {@code GATEKEEPER_DEBUG}) is set. Console output goes to stderr, so this
 * never pollutes the hook response on stdout.
 */
@Component
public class DebugLogging {

    private static final Logger log = LoggerFactory.getLogger(DebugLogging.class);

    private final GatekeeperProperties properties;
    private final LoggingSystem loggingSystem;

    public DebugLogging(GatekeeperProperties properties, LoggingSystem loggingSystem) {
        this.properties = properties;
        this.loggingSystem = loggingSystem;
    }

    @PostConstruct
    void apply() {
        if (properties.isDebug()) {
            loggingSystem.setLogLevel("com.gatekeeper", LogLevel.DEBUG);
            log.debug("Debug diagnostics enabled (fast mode: {})", properties.isFast());
        }
    }
}

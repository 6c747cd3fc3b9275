package com.gatekeeper.core.health;

import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.cache.ValidationCache;
import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.config.GatekeeperProperties.ToolDefinition;
import com.gatekeeper.core.invoker.ToolCommand;
import com.gatekeeper.core.invoker.ToolInvoker;
import com.gatekeeper.core.invoker.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the collaborators the gates depend on: the decision log directory,
 * the {@code git} CLI used for incremental scopes and each configured tool.
 * A missing tool is DEGRADED rather than DOWN because validation skips it.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DecisionLogger decisionLogger;
    private final ToolInvoker toolInvoker;
    private final ValidationCache cache;
    private final GatekeeperProperties properties;

    public HealthCheckService(DecisionLogger decisionLogger,
                              ToolInvoker toolInvoker,
                              ValidationCache cache,
                              GatekeeperProperties properties) {
        this.decisionLogger = decisionLogger;
        this.toolInvoker = toolInvoker;
        this.cache = cache;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDecisionLog());
        results.add(checkGit());
        results.add(checkCache());
        for (ToolDefinition tool : properties.getTools().getDefinitions()) {
            results.add(checkTool(tool));
        }
        return results;
    }

    private HealthStatus checkDecisionLog() {
        Path directory = decisionLogger.directory();
        try {
            Files.createDirectories(directory);
            if (Files.isWritable(directory)) {
                return new HealthStatus("decision-log", HealthStatus.Status.UP,
                        "Writable at " + directory, Map.of("directory", directory.toString()));
            }
            return new HealthStatus("decision-log", HealthStatus.Status.DOWN,
                    "Not writable: " + directory, Map.of("directory", directory.toString()));
        } catch (IOException e) {
            log.warn("Decision log health check failed: {}", e.getMessage());
            return new HealthStatus("decision-log", HealthStatus.Status.DOWN,
                    "Cannot create " + directory + ": " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkGit() {
        ToolResult result = toolInvoker.run(new ToolCommand("git", List.of("git", "--version"),
                properties.resolveProjectDir(), Duration.ofSeconds(10)));
        if (result.success()) {
            return new HealthStatus("git", HealthStatus.Status.UP, result.stdout().strip(), Map.of());
        }
        return new HealthStatus("git", HealthStatus.Status.DEGRADED,
                "git unavailable (" + result.status() + "), incremental validation widens to full",
                Map.of());
    }

    private HealthStatus checkCache() {
        var stats = cache.stats();
        return new HealthStatus("cache", HealthStatus.Status.UP,
                stats.size() + "/" + cache.capacity() + " entries, ttl " + cache.ttl().toSeconds() + "s"
                        + (properties.isFast() ? " (bypassed: fast mode)" : ""),
                Map.of("hits", String.valueOf(stats.hits()),
                        "misses", String.valueOf(stats.misses()),
                        "evictions", String.valueOf(stats.evictions())));
    }

    private HealthStatus checkTool(ToolDefinition tool) {
        String component = "tool:" + tool.getName();
        if (tool.getCommand() == null || tool.getCommand().isEmpty()) {
            return new HealthStatus(component, HealthStatus.Status.DOWN, "No command configured", Map.of());
        }
        String executable = tool.getCommand().get(0);
        return findExecutable(executable)
                .map(path -> new HealthStatus(component, HealthStatus.Status.UP,
                        "Found " + path, Map.of("kind", tool.getKind())))
                .orElseGet(() -> new HealthStatus(component, HealthStatus.Status.DEGRADED,
                        "'" + executable + "' not found on PATH, " + tool.getKind() + " checks are skipped",
                        Map.of("kind", tool.getKind())));
    }

    static Optional<Path> findExecutable(String executable) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path direct = Path.of(executable);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(executable);
            if (Files.isExecutable(candidate) && !Files.isDirectory(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}

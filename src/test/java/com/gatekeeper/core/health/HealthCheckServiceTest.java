package com.gatekeeper.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.cache.ValidationCache;
import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.config.GatekeeperProperties.ToolDefinition;
import com.gatekeeper.core.invoker.ToolInvoker;
import com.gatekeeper.core.invoker.ToolResult;
import com.gatekeeper.core.invoker.ToolStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    @TempDir
    Path dir;

    private GatekeeperProperties properties;
    private ValidationCache cache;

    @BeforeEach
    void setUp() {
        properties = new GatekeeperProperties();
        properties.setProjectDir(dir.toString());
        cache = new ValidationCache(32, Duration.ofMinutes(5), 0.8, Clock.systemUTC());
    }

    private HealthCheckService service(Path logDir, ToolInvoker invoker) {
        return new HealthCheckService(new DecisionLogger(logDir, new ObjectMapper()), invoker, cache, properties);
    }

    private static ToolInvoker gitWorks() {
        return command -> new ToolResult("git", ToolStatus.SUCCEEDED, 0, "git version 2.43.0\n", "", 4);
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    private static ToolDefinition tool(String name, List<String> command) {
        var def = new ToolDefinition();
        def.setName(name);
        def.setKind("lint");
        def.setCommand(command);
        return def;
    }

    @Test
    @DisplayName("checkAll returns decision-log, git, cache and one entry per tool")
    void checkAllReturnsAllComponents() {
        properties.getTools().setDefinitions(List.of(tool("eslint", List.of("eslint"))));

        var components = service(dir.resolve("logs"), gitWorks()).checkAll().stream()
                .map(HealthStatus::component).toList();

        assertEquals(List.of("decision-log", "git", "cache", "tool:eslint"), components);
    }

    @Test
    @DisplayName("Writable log directory and git available -> UP")
    void healthy() {
        var results = service(dir.resolve("logs"), gitWorks()).checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "decision-log").status());
        assertTrue(Files.isDirectory(dir.resolve("logs")));
        var git = component(results, "git");
        assertEquals(HealthStatus.Status.UP, git.status());
        assertEquals("git version 2.43.0", git.detail());
        assertEquals("0", component(results, "cache").metadata().get("hits"));
    }

    @Test
    @DisplayName("Log directory that cannot be created -> DOWN")
    void logDirectoryBlocked() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");

        var results = service(blocker.resolve("logs"), gitWorks()).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "decision-log").status());
    }

    @Test
    @DisplayName("git missing -> DEGRADED")
    void gitMissing() {
        var results = service(dir.resolve("logs"), command -> ToolResult.notFound("git", "not installed")).checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(results, "git").status());
    }

    @Test
    @DisplayName("Tool executables are looked up, missing ones DEGRADED, unconfigured ones DOWN")
    void tools() throws IOException {
        Path executable = Files.writeString(dir.resolve("fake-lint"), "#!/bin/sh\nexit 0\n");
        assertTrue(executable.toFile().setExecutable(true));
        properties.getTools().setDefinitions(List.of(
                tool("present", List.of(executable.toString())),
                tool("absent", List.of(dir.resolve("no-such-linter").toString())),
                tool("empty", List.of())));

        var results = service(dir.resolve("logs"), gitWorks()).checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "tool:present").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "tool:absent").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "tool:empty").status());
    }
}

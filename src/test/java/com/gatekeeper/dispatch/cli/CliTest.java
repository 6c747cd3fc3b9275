package com.gatekeeper.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gatekeeper.core.audit.DecisionLogEntry;
import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.health.HealthCheckService;
import com.gatekeeper.core.health.HealthStatus;
import com.gatekeeper.core.hook.HookRouter;
import com.gatekeeper.core.hook.MalformedEventException;
import com.gatekeeper.core.model.GateType;
import com.gatekeeper.core.model.HookPhase;
import com.gatekeeper.core.model.Verdict;
import com.gatekeeper.core.model.Violation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Gatekeeper CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, hook exit codes and log output.
 */
class CliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private record CliResult(int exitCode, String out, String err) {}

    @TempDir
    Path logDir;

    private HookRouter router;
    private HealthCheckService healthCheckService;
    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        router = mock(HookRouter.class);
        healthCheckService = mock(HealthCheckService.class);
        decisionLogger = new DecisionLogger(logDir, MAPPER);
    }

    @AfterEach
    void tearDown() {
        decisionLogger.close();
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HookCommand.class) {
                    return cls.cast(new HookCommand(router, MAPPER));
                }
                if (cls == HealthCommand.class) {
                    return cls.cast(new HealthCommand(healthCheckService));
                }
                if (cls == LogCommand.class) {
                    return cls.cast(new LogCommand(decisionLogger));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return executeWithInput("", args);
    }

    private CliResult executeWithInput(String stdin, String... args) {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        InputStream originalIn = System.in;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
        System.setIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        try {
            int exitCode = CliRunner.commandLine(new GatekeeperCommand(), factory()).execute(args);
            return new CliResult(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            System.setIn(originalIn);
        }
    }

    // ── Structure ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Command structure")
    class StructureTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("hook"));
            assertTrue(result.out().contains("serve"));
            assertTrue(result.out().contains("health"));
            assertTrue(result.out().contains("log"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("Gatekeeper 0.1.0"));
        }

        @Test
        @DisplayName("hook --help describes stdin input")
        void hookHelp() {
            CliResult result = execute("hook", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("stdin"));
            assertTrue(result.out().contains("--phase"));
        }

        @Test
        @DisplayName("unknown options exit 1, never the block code")
        void unknownOption() {
            CliResult result = execute("hook", "--bogus");

            assertEquals(CliRunner.USAGE_EXIT_CODE, result.exitCode());
            assertNotEquals(HookCommand.BLOCK_EXIT_CODE, result.exitCode());
            assertTrue(result.err().contains("--bogus"));
            assertTrue(result.err().contains("Usage:"));
        }

        @Test
        @DisplayName("unknown top-level option exits 1")
        void unknownTopLevelOption() {
            CliResult result = execute("--frobnicate");

            assertEquals(CliRunner.USAGE_EXIT_CODE, result.exitCode());
            assertTrue(result.err().contains("--frobnicate"));
        }

        @Test
        @DisplayName("option missing its value exits 1")
        void missingOptionValue() {
            assertEquals(CliRunner.USAGE_EXIT_CODE, execute("log", "--limit").exitCode());
        }
    }

    // ── hook ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("hook")
    class HookTests {

        private static final String EVENT = "{\"hook_event_name\":\"PreToolUse\",\"tool_name\":\"Bash\"}";

        @Test
        @DisplayName("approval prints the verdict and exits 0")
        void approve() throws Exception {
            when(router.route(EVENT, null)).thenReturn(Optional.of(Verdict.approve("")));

            CliResult result = executeWithInput(EVENT, "hook");

            assertEquals(0, result.exitCode());
            var json = MAPPER.readTree(result.out());
            assertTrue(json.get("approve").asBoolean());
            assertFalse(json.get("hard_block").asBoolean());
        }

        @Test
        @DisplayName("hard block exits 2 and repeats the message on stderr")
        void block() throws Exception {
            var verdict = Verdict.block("Blocked destructive command [destructive_delete]",
                    List.of(Violation.error("destructive_delete", "rm -rf", null, "Delete specific files")));
            when(router.route(anyString(), any())).thenReturn(Optional.of(verdict));

            CliResult result = executeWithInput(EVENT, "hook");

            assertEquals(HookCommand.BLOCK_EXIT_CODE, result.exitCode());
            assertTrue(result.err().contains("Blocked destructive command [destructive_delete]"));
            var json = MAPPER.readTree(result.out());
            assertFalse(json.get("approve").asBoolean());
            assertEquals("destructive_delete", json.get("violations").get(0).get("rule_id").asText());
        }

        @Test
        @DisplayName("approval with warnings exits 0")
        void warnings() throws Exception {
            var verdict = Verdict.approve("Allowed with warnings:\n[privilege_escalation] - sudo",
                    List.of(Violation.warning("privilege_escalation", "sudo", null)));
            when(router.route(anyString(), any())).thenReturn(Optional.of(verdict));

            assertEquals(0, executeWithInput(EVENT, "hook").exitCode());
        }

        @Test
        @DisplayName("malformed event produces no output and exits 0")
        void malformed() throws Exception {
            when(router.route(anyString(), any())).thenThrow(new MalformedEventException("Empty hook event"));

            CliResult result = executeWithInput("", "hook");

            assertEquals(0, result.exitCode());
            assertEquals("", result.out());
        }

        @Test
        @DisplayName("skipped event produces no output and exits 0")
        void skipped() throws Exception {
            when(router.route(anyString(), any())).thenReturn(Optional.empty());

            CliResult result = executeWithInput(EVENT, "hook");

            assertEquals(0, result.exitCode());
            assertEquals("", result.out());
        }

        @Test
        @DisplayName("--phase overrides the event phase")
        void phaseOverride() throws Exception {
            when(router.route(anyString(), any())).thenReturn(Optional.of(Verdict.approve("All checks passed")));

            executeWithInput("{}", "hook", "--phase", "completion-check");

            verify(router).route("{}", HookPhase.COMPLETION_CHECK);
        }

        @Test
        @DisplayName("unknown --phase exits 1")
        void unknownPhase() {
            CliResult result = executeWithInput("{}", "hook", "--phase", "sometime");

            assertEquals(1, result.exitCode());
            assertTrue(result.err().contains("Unknown phase 'sometime'"));
        }
    }

    // ── health ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all components up exits 0")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("decision-log", HealthStatus.Status.UP, "Writable", Map.of()),
                    new HealthStatus("tool:eslint", HealthStatus.Status.DEGRADED, "not found", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("decision-log: Writable"));
            assertTrue(result.out().contains("operational with skipped checks"));
        }

        @Test
        @DisplayName("a DOWN component exits 1")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("decision-log", HealthStatus.Status.DOWN, "Not writable", Map.of())));

            assertEquals(1, execute("health").exitCode());
        }
    }

    // ── log ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("log")
    class LogTests {

        private void record(GateType gate, String decision, String request) {
            decisionLogger.append(gate, new DecisionLogEntry(Instant.parse("2026-03-01T10:00:00Z"),
                    gate.logName(), "pre-action", "s1", "Bash", request, decision,
                    "reason for " + request, List.of(), 2, List.of(), null));
        }

        @Test
        @DisplayName("empty logs say so")
        void empty() {
            CliResult result = execute("log");
            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("No decisions recorded."));
        }

        @Test
        @DisplayName("shows recorded decisions for one gate")
        void oneGate() {
            record(GateType.PRE_ACTION, DecisionLogEntry.BLOCK, "pre-action Bash command=rm -rf /");
            record(GateType.COMPLETION, DecisionLogEntry.APPROVE, "completion-check");

            CliResult result = execute("log", "--gate", "pre_action");

            assertEquals(0, result.exitCode());
            assertTrue(result.out().contains("pre-action Bash command=rm -rf /"));
            assertFalse(result.out().contains("completion-check"));
        }

        @Test
        @DisplayName("--blocked hides approvals")
        void blockedOnly() {
            record(GateType.PRE_ACTION, DecisionLogEntry.BLOCK, "pre-action Bash command=git push --force");
            record(GateType.PRE_ACTION, DecisionLogEntry.APPROVE, "pre-action Bash command=ls");

            CliResult result = execute("log", "--gate", "pre-action", "--blocked");

            assertTrue(result.out().contains("git push --force"));
            assertFalse(result.out().contains("command=ls"));
        }

        @Test
        @DisplayName("unknown gate exits 1")
        void unknownGate() {
            assertEquals(1, execute("log", "--gate", "post").exitCode());
        }
    }
}

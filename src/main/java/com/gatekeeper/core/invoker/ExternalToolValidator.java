package com.gatekeeper.core.invoker;

import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.config.GatekeeperProperties.ToolDefinition;
import com.gatekeeper.core.logging.MdcContext;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.Severity;
import com.gatekeeper.core.model.ValidationScope;
import com.gatekeeper.core.model.Verdict;
import com.gatekeeper.core.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the configured lint, type-check and test tools over a {@link ValidationScope}
 * and turns each {@link ToolResult} into a {@link Verdict}.
 * <p>
 * Mapping: success approves; a missing tool approves with an informational
 * {@code tool_unavailable} finding; a non-zero exit, a timeout or a start failure
 * yields an error violation carrying the tool's output, truncated to
 * {@code gatekeeper.tools.max-output-chars}.
 */
@Service
public class ExternalToolValidator {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolValidator.class);

    private final ToolInvoker invoker;
    private final GatekeeperProperties.Tools config;
    private final GatekeeperMetrics metrics;

    public ExternalToolValidator(ToolInvoker invoker,
                                 GatekeeperProperties properties,
                                 @Autowired(required = false) GatekeeperMetrics metrics) {
        this.invoker = invoker;
        this.config = properties.getTools();
        this.metrics = metrics;
    }

    /** Tools whose modes include the scope's mode and whose extensions match at least one file. */
    public List<ToolDefinition> applicableTools(ValidationScope scope) {
        var tools = new ArrayList<ToolDefinition>();
        for (ToolDefinition tool : config.getDefinitions()) {
            if (tool.getCommand() == null || tool.getCommand().isEmpty()) {
                continue;
            }
            if (!tool.getModes().contains(scope.mode().name())) {
                continue;
            }
            if (!matchingFiles(tool, scope).isEmpty()) {
                tools.add(tool);
            }
        }
        return tools;
    }

    /**
     * Runs one tool. Never throws: invoker failures become error verdicts.
     */
    public Verdict validate(ToolDefinition tool, ValidationScope scope, Path projectDir) {
        return run(tool, scope, projectDir).verdict();
    }

    /** Like {@link #validate} but also reports how the run ended. */
    public ToolRun run(ToolDefinition tool, ValidationScope scope, Path projectDir) {
        var arguments = new ArrayList<>(tool.getCommand());
        if (tool.isAppendFiles()) {
            for (Path file : matchingFiles(tool, scope)) {
                arguments.add(projectDir.relativize(file).toString());
            }
        }
        var command = new ToolCommand(tool.getName(), arguments, projectDir,
                Duration.ofSeconds(config.getTimeoutSeconds()));

        ToolResult result;
        MdcContext.setValidator(tool.getName());
        try {
            result = invoker.run(command);
        } catch (RuntimeException e) {
            log.error("Tool invoker threw for {}", tool.getName(), e);
            result = ToolResult.error(tool.getName(), e.toString(), 0L);
        } finally {
            MdcContext.clearValidator();
        }

        if (metrics != null) {
            metrics.recordToolRun(tool.getName(), result.status().name().toLowerCase(Locale.ROOT), result.durationMs());
        }
        return new ToolRun(result.status(), toVerdict(tool, command, result));
    }

    Verdict toVerdict(ToolDefinition tool, ToolCommand command, ToolResult result) {
        String label = tool.getName() + " (" + tool.getKind() + ")";
        return switch (result.status()) {
            case SUCCEEDED -> Verdict.approve(label + " passed");
            case NOT_FOUND -> {
                log.info("Skipping {}: {}", tool.getName(), result.stderr());
                yield Verdict.approve(label + " skipped",
                        List.of(Violation.of("tool_unavailable",
                                label + " skipped: " + result.stderr(), Severity.INFO)));
            }
            case FAILED -> failure(tool, command, "failure",
                    label + " exited with code " + result.exitCode(), result);
            case TIMED_OUT -> failure(tool, command, "timeout",
                    label + " timed out after " + config.getTimeoutSeconds() + "s", result);
            case ERROR -> failure(tool, command, "error",
                    label + " could not run", result);
        };
    }

    private Verdict failure(ToolDefinition tool, ToolCommand command, String suffix, String summary, ToolResult result) {
        String ruleId = tool.getKind().toLowerCase(Locale.ROOT).replace('-', '_') + "_" + suffix;
        String output = truncate(result.combinedOutput().strip(), config.getMaxOutputChars());
        String message = output.isEmpty() ? summary : summary + ":\n" + output;
        var violation = new Violation(ruleId, message, Severity.ERROR, null, 0,
                "Run `" + command.display() + "` and fix every reported problem.");
        log.info("{} ({}ms)", summary, result.durationMs());
        return new Verdict(false, summary, List.of(violation), false);
    }

    private List<Path> matchingFiles(ToolDefinition tool, ValidationScope scope) {
        if (tool.getExtensions() == null || tool.getExtensions().isEmpty()) {
            return scope.files();
        }
        return scope.files().stream()
                .filter(f -> tool.getExtensions().contains(extension(f)))
                .toList();
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "\n... (" + (text.length() - maxChars) + " more characters)";
    }
}

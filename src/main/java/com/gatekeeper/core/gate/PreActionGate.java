package com.gatekeeper.core.gate;

import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.classifier.PatternClassifier;
import com.gatekeeper.core.classifier.ThreatCategory;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.GateType;
import com.gatekeeper.core.model.Severity;
import com.gatekeeper.core.model.ToolKind;
import com.gatekeeper.core.model.Verdict;
import com.gatekeeper.core.model.Violation;
import com.gatekeeper.core.security.FileAccessPolicy;
import com.gatekeeper.core.security.PathSafetyResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether an action may run at all.
 * <p>
 * Checks run in a fixed order and the first hard block wins:
 * <ol>
 *   <li>{@code ENV_FILE_CHECK}: reading, writing or naming an environment file</li>
 *   <li>{@code DESTRUCTIVE_COMMAND_CHECK}: hard-block threat categories from the {@link PatternClassifier}</li>
 *   <li>{@code ROOT_STRUCTURE_CHECK}: path traversal, writes to protected files and new
 *       files directly in the project root that are not allow-listed</li>
 *   <li>{@code COMMAND_FILE_WARN}: advisory only</li>
 * </ol>
 * Non-hard classifier categories and advisories are returned as warnings on an
 * approving verdict.
 */
@Service
public class PreActionGate extends AbstractGate {

    public static final String ENV_FILE_ACCESS = "env_file_access";
    public static final String PATH_TRAVERSAL = "path_traversal";
    public static final String PROTECTED_FILE_WRITE = "protected_file_write";
    public static final String ROOT_STRUCTURE = "root_structure";
    public static final String COMMAND_FILE_MODIFICATION = "command_file_modification";

    private final PatternClassifier classifier;
    private final PathSafetyResolver pathSafetyResolver;
    private final FileAccessPolicy fileAccessPolicy;
    private final GatekeeperMetrics metrics;

    public PreActionGate(PatternClassifier classifier,
                         PathSafetyResolver pathSafetyResolver,
                         FileAccessPolicy fileAccessPolicy,
                         DecisionLogger decisionLogger,
                         @Autowired(required = false) GatekeeperMetrics metrics,
                         Clock clock) {
        super(GateType.PRE_ACTION, decisionLogger, metrics, clock);
        this.classifier = classifier;
        this.pathSafetyResolver = pathSafetyResolver;
        this.fileAccessPolicy = fileAccessPolicy;
        this.metrics = metrics;
    }

    @Override
    protected Verdict doEvaluate(ActionRequest request, StageTracker stages) {
        ToolKind kind = ToolKind.of(request.toolName());
        var warnings = new ArrayList<Violation>();

        Optional<Verdict> blocked = checkEnvFile(request);
        if (blocked.isEmpty()) {
            blocked = checkDestructiveCommand(request, warnings);
        }
        stages.enter(GateStage.CLASSIFIED);
        if (blocked.isEmpty()) {
            blocked = checkRootStructure(request, kind);
        }
        stages.enter(GateStage.VALIDATED);
        if (blocked.isPresent()) {
            return blocked.get();
        }

        warnCommandFile(request, kind).ifPresent(warnings::add);
        if (warnings.isEmpty()) {
            return Verdict.approve("");
        }
        String message = warnings.stream()
                .map(Violation::describe)
                .collect(Collectors.joining("\n", "Allowed with warnings:\n", ""));
        return Verdict.approve(message, warnings);
    }

    private Optional<Verdict> checkEnvFile(ActionRequest request) {
        if (request.hasResource() && fileAccessPolicy.isEnvFile(request.resourcePath())) {
            return Optional.of(block(ENV_FILE_ACCESS,
                    "Access to environment file '" + request.resourcePath() + "' is not allowed",
                    request.resourcePath(),
                    "Environment files hold secrets. Use one of " + fileAccessPolicy.envFileExemptions()
                            + " to document variables instead"));
        }
        if (request.hasCommand() && fileAccessPolicy.commandTouchesEnvFile(request.commandText())) {
            return Optional.of(block(ENV_FILE_ACCESS,
                    "Command references an environment file",
                    null,
                    "Do not read or modify environment files from the shell; ask the user to change them"));
        }
        return Optional.empty();
    }

    private Optional<Verdict> checkDestructiveCommand(ActionRequest request, List<Violation> warnings) {
        if (!request.hasCommand()) {
            return Optional.empty();
        }
        var hard = new ArrayList<Violation>();
        for (Violation violation : classifier.classify(request.commandText())) {
            if (metrics != null) {
                metrics.recordClassifierMatch(violation.ruleId());
            }
            boolean hardBlock = ThreatCategory.fromRuleId(violation.ruleId())
                    .map(ThreatCategory::isHardBlock)
                    .orElse(violation.isError());
            if (hardBlock) {
                hard.add(violation);
            } else {
                warnings.add(new Violation(violation.ruleId(), violation.message(), Severity.WARNING,
                        null, 0, violation.fix()));
            }
        }
        if (hard.isEmpty()) {
            return Optional.empty();
        }
        String categories = hard.stream().map(Violation::ruleId).collect(Collectors.joining(", "));
        var message = new StringBuilder("Blocked destructive command [").append(categories).append("]");
        for (Violation v : hard) {
            message.append("\n- ").append(v.ruleId()).append(": ").append(v.message());
            if (v.fix() != null) {
                message.append("\n  Fix: ").append(v.fix());
            }
        }
        return Optional.of(Verdict.block(message.toString(), hard));
    }

    private Optional<Verdict> checkRootStructure(ActionRequest request, ToolKind kind) {
        if (!request.hasResource()) {
            return Optional.empty();
        }
        String requested = request.resourcePath();
        Optional<Path> relative = pathSafetyResolver.resolveRelative(requested, request.projectDir());
        if (relative.isEmpty()) {
            return Optional.of(block(PATH_TRAVERSAL,
                    "Path '" + requested + "' resolves outside the project directory",
                    requested,
                    "Use a path inside the project without '..', encoded separators or drive prefixes"));
        }
        if (kind != ToolKind.FILE_WRITE) {
            return Optional.empty();
        }

        Path rel = relative.get();
        String relPath = rel.toString().replace('\\', '/');
        if (fileAccessPolicy.isProtected(relPath)) {
            return Optional.of(block(PROTECTED_FILE_WRITE,
                    "'" + relPath + "' is a protected file",
                    relPath,
                    "Protected files may only be changed by the user"));
        }
        if ("Write".equals(request.toolName())
                && fileAccessPolicy.enforcesRootStructure()
                && rel.getNameCount() == 1
                && !Files.exists(request.projectDir().resolve(rel))
                && !fileAccessPolicy.isAllowedInRoot(relPath)) {
            return Optional.of(block(ROOT_STRUCTURE,
                    "New file '" + relPath + "' would be created in the project root",
                    relPath,
                    "Place the file in an appropriate subdirectory (e.g. src/, docs/, scripts/)"));
        }
        return Optional.empty();
    }

    private Optional<Violation> warnCommandFile(ActionRequest request, ToolKind kind) {
        if (kind != ToolKind.FILE_WRITE || !request.hasResource()) {
            return Optional.empty();
        }
        return pathSafetyResolver.resolveRelative(request.resourcePath(), request.projectDir())
                .map(rel -> rel.toString().replace('\\', '/'))
                .filter(fileAccessPolicy::isCommandFile)
                .map(rel -> new Violation(COMMAND_FILE_MODIFICATION,
                        "Modifying command definition '" + rel + "' changes what future sessions can run",
                        Severity.WARNING, rel, 0, "Review the change with the user before relying on it"));
    }

    private static Verdict block(String ruleId, String message, String path, String fix) {
        var violation = Violation.error(ruleId, message, path, fix);
        return Verdict.block(ruleId + ": " + message + ". " + fix, List.of(violation));
    }
}

package com.gatekeeper.core.gate;

import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.cache.CacheKey;
import com.gatekeeper.core.cache.ContentFingerprinter;
import com.gatekeeper.core.cache.ValidationCache;
import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.config.GatekeeperProperties.ToolDefinition;
import com.gatekeeper.core.invoker.ExternalToolValidator;
import com.gatekeeper.core.invoker.ToolRun;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.GateType;
import com.gatekeeper.core.model.Severity;
import com.gatekeeper.core.model.ValidationScope;
import com.gatekeeper.core.model.Verdict;
import com.gatekeeper.core.model.Violation;
import com.gatekeeper.core.scope.ScopeSelector;
import com.gatekeeper.core.standards.CodeStandardsChecker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Validates the work an agent has produced: code-standards checks per file plus the
 * configured external tools over the selected {@link ValidationScope}.
 * <p>
 * Every sub-check yields a {@link Verdict}; results are memoised in the
 * {@link ValidationCache} under the content fingerprint of the files they cover,
 * unless fast mode is on. Tool runs that timed out, failed to start or found no
 * executable are never memoised, so the next attempt runs the tool again. Any error-severity finding blocks completion and the
 * message lists every failing check with its fix.
 */
@Service
public class CompletionGate extends AbstractGate {

    private final ScopeSelector scopeSelector;
    private final CodeStandardsChecker standardsChecker;
    private final ExternalToolValidator toolValidator;
    private final ValidationCache cache;
    private final ContentFingerprinter fingerprinter;
    private final GatekeeperProperties properties;
    private final GatekeeperMetrics metrics;

    public CompletionGate(ScopeSelector scopeSelector,
                          CodeStandardsChecker standardsChecker,
                          ExternalToolValidator toolValidator,
                          ValidationCache cache,
                          ContentFingerprinter fingerprinter,
                          GatekeeperProperties properties,
                          DecisionLogger decisionLogger,
                          @Autowired(required = false) GatekeeperMetrics metrics,
                          Clock clock) {
        super(GateType.COMPLETION, decisionLogger, metrics, clock);
        this.scopeSelector = scopeSelector;
        this.standardsChecker = standardsChecker;
        this.toolValidator = toolValidator;
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    protected Verdict doEvaluate(ActionRequest request, StageTracker stages) {
        ValidationScope scope = scopeSelector.select(request);
        stages.recordMode(scope.mode());
        stages.enter(GateStage.CLASSIFIED);
        log.debug("Scope {} with {} files ({})", scope.mode(), scope.files().size(), scope.reason());
        if (scope.isEmpty()) {
            stages.enter(GateStage.VALIDATED);
            return Verdict.approve("Nothing to validate: " + scope.reason());
        }

        Path projectDir = scopeSelector.projectRoot(request);
        stages.enter(GateStage.CACHE_CHECK);
        var results = new ArrayList<Verdict>();
        for (Path file : scope.files()) {
            results.add(memoised("standards:" + file, () -> fingerprinter.fingerprint(file),
                    () -> new Outcome(standardsVerdict(file, projectDir), true)));
        }
        for (ToolDefinition tool : toolValidator.applicableTools(scope)) {
            results.add(memoised("tool:" + tool.getName() + ":" + scope.mode() + ":" + projectDir,
                    () -> fingerprinter.fingerprintAll(scope.files()),
                    () -> {
                        ToolRun run = toolValidator.run(tool, scope, projectDir);
                        return new Outcome(run.verdict(), run.cacheable());
                    }));
        }
        stages.enter(GateStage.VALIDATED);
        return aggregate(results);
    }

    private Verdict standardsVerdict(Path file, Path projectDir) {
        List<Violation> violations = standardsChecker.check(file, projectDir);
        boolean failing = violations.stream().anyMatch(Violation::isError);
        return new Verdict(!failing, "code standards", violations, false);
    }

    private record Outcome(Verdict verdict, boolean cacheable) {}

    private Verdict memoised(String resource, Supplier<String> fingerprint, Supplier<Outcome> validation) {
        if (properties.isFast()) {
            return validation.get().verdict();
        }
        CacheKey key;
        try {
            key = new CacheKey(resource, fingerprint.get());
        } catch (UncheckedIOException e) {
            log.warn("Cannot fingerprint {}, validating without the cache: {}", resource, e.getMessage());
            return validation.get().verdict();
        }
        var cached = cache.get(key);
        if (metrics != null) {
            metrics.recordCacheLookup(cached.isPresent());
        }
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", resource);
            return cached.get();
        }
        Outcome outcome = validation.get();
        if (outcome.cacheable()) {
            cache.put(key, outcome.verdict());
        } else {
            log.debug("Not caching inconclusive result for {}", resource);
        }
        return outcome.verdict();
    }

    /**
     * Folds sub-verdicts into one. Any error violation or refusing sub-verdict blocks;
     * otherwise the result approves, carrying warnings through.
     */
    static Verdict aggregate(List<Verdict> results) {
        var violations = new ArrayList<Violation>();
        var failingSummaries = new ArrayList<String>();
        for (Verdict result : results) {
            violations.addAll(result.violations());
            if (!result.approve() && !result.hasErrors()) {
                failingSummaries.add(result.message());
            }
        }
        List<Violation> errors = violations.stream().filter(Violation::isError).toList();
        List<Violation> warnings = violations.stream()
                .filter(v -> v.severity() == Severity.WARNING)
                .toList();

        if (!errors.isEmpty() || !failingSummaries.isEmpty()) {
            var message = new StringBuilder("Completion blocked: ")
                    .append(errors.size() + failingSummaries.size())
                    .append(" failing check(s). Fix every item below, then finish again.");
            int n = 1;
            for (Violation error : errors) {
                message.append("\n").append(n++).append(". ").append(error.describe());
                if (error.fix() != null) {
                    message.append("\n   Fix: ").append(error.fix());
                }
            }
            for (String summary : failingSummaries) {
                message.append("\n").append(n++).append(". ").append(summary);
            }
            return Verdict.block(message.toString(), violations);
        }
        if (!warnings.isEmpty()) {
            var message = new StringBuilder("All checks passed with ")
                    .append(warnings.size()).append(" warning(s):");
            for (Violation warning : warnings) {
                message.append("\n- ").append(warning.describe());
            }
            return Verdict.approve(message.toString(), violations);
        }
        return Verdict.approve("All checks passed", violations);
    }
}

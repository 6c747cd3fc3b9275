package com.gatekeeper.core.hook;

import com.gatekeeper.core.gate.CompletionGate;
import com.gatekeeper.core.gate.PreActionGate;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.HookPhase;
import com.gatekeeper.core.model.ToolKind;
import com.gatekeeper.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Dispatches a hook event to the gate responsible for its phase.
 * <ul>
 *   <li>pre-action: {@link PreActionGate}</li>
 *   <li>post-action: {@link CompletionGate} for tools that can change files
 *       (one file for edit tools, changed files for shell commands); skipped otherwise</li>
 *   <li>completion-check: {@link CompletionGate} over the whole project</li>
 * </ul>
 */
@Service
public class HookRouter {

    private static final Logger log = LoggerFactory.getLogger(HookRouter.class);

    private final HookEventParser parser;
    private final PreActionGate preActionGate;
    private final CompletionGate completionGate;

    public HookRouter(HookEventParser parser, PreActionGate preActionGate, CompletionGate completionGate) {
        this.parser = parser;
        this.preActionGate = preActionGate;
        this.completionGate = completionGate;
    }

    /**
     * @return the verdict, or empty when the event needs no evaluation
     * @throws MalformedEventException when required event fields are missing
     */
    public Optional<Verdict> route(String json, HookPhase phaseOverride) throws MalformedEventException {
        return route(parser.parse(json, phaseOverride));
    }

    public Optional<Verdict> route(ActionRequest request) {
        return switch (request.phase()) {
            case PRE_ACTION -> Optional.of(preActionGate.evaluate(request));
            case POST_ACTION -> {
                if (!ToolKind.of(request.toolName()).mutatesFiles()) {
                    log.debug("Skipping post-action validation for {}", request.toolName());
                    yield Optional.empty();
                }
                yield Optional.of(completionGate.evaluate(request));
            }
            case COMPLETION_CHECK -> Optional.of(completionGate.evaluate(request));
        };
    }
}

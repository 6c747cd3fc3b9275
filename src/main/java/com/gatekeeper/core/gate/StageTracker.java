package com.gatekeeper.core.gate;

import com.gatekeeper.core.model.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the stages one evaluation has entered, and the validation mode once a
 * scope is chosen. Both end up in the decision log.
 */
public final class StageTracker {

    private static final Logger log = LoggerFactory.getLogger(StageTracker.class);

    private final List<GateStage> visited = new ArrayList<>();
    private ValidationMode mode;

    public void enter(GateStage stage) {
        visited.add(stage);
        log.debug("-> {}", stage);
    }

    public GateStage current() {
        return visited.isEmpty() ? null : visited.get(visited.size() - 1);
    }

    public List<GateStage> visited() {
        return List.copyOf(visited);
    }

    public void recordMode(ValidationMode mode) {
        this.mode = mode;
    }

    /** Null for evaluations that never selected a scope. */
    public ValidationMode mode() {
        return mode;
    }
}

package com.gatekeeper.core.invoker;

import com.gatekeeper.core.model.Verdict;

/**
 * One tool run as seen by a gate: how the run ended and the verdict derived from it.
 */
public record ToolRun(ToolStatus status, Verdict verdict) {

    /** Only conclusive runs may be memoised. */
    public boolean cacheable() {
        return status.isConclusive();
    }
}

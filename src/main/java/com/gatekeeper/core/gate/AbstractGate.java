package com.gatekeeper.core.gate;

import com.gatekeeper.core.audit.DecisionLogEntry;
import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.logging.MdcContext;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.GateType;
import com.gatekeeper.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Shared evaluation skeleton for the pre-action and completion gates.
 * <p>
 * Two error channels with different defaults:
 * <ul>
 *   <li>violations found by a check are returned by {@link #doEvaluate} and are final,
 *       a hard block is never downgraded;</li>
 *   <li>an unexpected {@link RuntimeException} escaping {@link #doEvaluate} is an internal
 *       fault: it is logged with its stack trace and the action is allowed
 *       ({@link Verdict#internalFault}).</li>
 * </ul>
 * Either way the decision is recorded in the decision log before it is returned.
 */
public abstract class AbstractGate {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final GateType type;
    private final DecisionLogger decisionLogger;
    private final GatekeeperMetrics metrics;
    private final Clock clock;

    protected AbstractGate(GateType type, DecisionLogger decisionLogger, GatekeeperMetrics metrics, Clock clock) {
        this.type = type;
        this.decisionLogger = decisionLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GateType type() {
        return type;
    }

    /**
     * Evaluates one request to a verdict. Never throws for faults inside the gate.
     */
    public final Verdict evaluate(ActionRequest request) {
        long started = System.nanoTime();
        var stages = new StageTracker();
        MdcContext.setEvaluation(request.sessionId(), type.logName(), request.toolName());
        try {
            stages.enter(GateStage.RECEIVED);
            Verdict verdict;
            try {
                verdict = doEvaluate(request, stages);
            } catch (RuntimeException e) {
                log.error("{} gate failed at stage {}, allowing the action: {}",
                        type.logName(), stages.current(), request.summary(), e);
                if (metrics != null) {
                    metrics.recordInternalFault(type.logName());
                }
                verdict = Verdict.internalFault(type.logName(), e);
            }
            stages.enter(GateStage.DECIDED);

            long durationMs = (System.nanoTime() - started) / 1_000_000;
            if (metrics != null) {
                metrics.recordDecision(type.logName(), verdict.approve(), durationMs);
            }
            decisionLogger.append(type, toLogEntry(request, verdict, durationMs, stages));
            stages.enter(GateStage.LOGGED);

            if (verdict.approve()) {
                log.info("Approved {} ({} findings, {}ms)", request.summary(), verdict.violations().size(), durationMs);
            } else {
                log.warn("Blocked {}: {}", request.summary(), verdict.ruleIds());
            }
            return verdict;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the gate's checks. Implementations enter {@link GateStage#CLASSIFIED},
     * optionally {@link GateStage#CACHE_CHECK}, and {@link GateStage#VALIDATED}.
     */
    protected abstract Verdict doEvaluate(ActionRequest request, StageTracker stages);

    private DecisionLogEntry toLogEntry(ActionRequest request, Verdict verdict, long durationMs,
                                        StageTracker stages) {
        return new DecisionLogEntry(
                clock.instant(),
                type.logName(),
                request.phase().wireName(),
                request.sessionId(),
                request.toolName(),
                request.summary(),
                verdict.approve() ? DecisionLogEntry.APPROVE : DecisionLogEntry.BLOCK,
                verdict.message(),
                verdict.ruleIds(),
                durationMs,
                stages.visited().stream().map(GateStage::name).toList(),
                stages.mode() == null ? null : stages.mode().name());
    }
}

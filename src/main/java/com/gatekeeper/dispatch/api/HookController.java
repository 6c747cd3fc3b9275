package com.gatekeeper.dispatch.api;

import com.gatekeeper.core.hook.HookRouter;
import com.gatekeeper.core.hook.MalformedEventException;
import com.gatekeeper.core.model.HookPhase;
import com.gatekeeper.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST endpoint for hook events, for hosts that post events to a long-running server.
 */
@RestController
@RequestMapping("/api/v1/hooks")
public class HookController {

    private static final Logger log = LoggerFactory.getLogger(HookController.class);

    private final HookRouter router;

    public HookController(HookRouter router) {
        this.router = router;
    }

    /**
     * POST /api/v1/hooks: evaluate one event.
     * Returns 200 with the verdict when approved, 403 with the verdict when blocked,
     * and 204 when the event is malformed or needs no evaluation.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Verdict> evaluate(@RequestBody(required = false) String body,
                                            @RequestParam(name = "phase", required = false) String phase) {
        HookPhase phaseOverride = null;
        if (phase != null) {
            Optional<HookPhase> parsed = HookPhase.fromWire(phase);
            if (parsed.isEmpty()) {
                log.warn("Declining hook event with unknown phase parameter '{}'", phase);
                return ResponseEntity.noContent().build();
            }
            phaseOverride = parsed.get();
        }

        Optional<Verdict> result;
        try {
            result = router.route(body, phaseOverride);
        } catch (MalformedEventException e) {
            log.warn("Declining malformed hook event: {}", e.getMessage());
            return ResponseEntity.noContent().build();
        }
        if (result.isEmpty()) {
            return ResponseEntity.noContent().build();
        }

        Verdict verdict = result.get();
        return verdict.approve()
                ? ResponseEntity.ok(verdict)
                : ResponseEntity.status(HttpStatus.FORBIDDEN).body(verdict);
    }
}

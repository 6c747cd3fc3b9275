package com.gatekeeper.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.hook.HookRouter;
import com.gatekeeper.core.hook.MalformedEventException;
import com.gatekeeper.core.model.HookPhase;
import com.gatekeeper.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: gatekeeper hook
 * <p>
 * Reads one hook event as JSON from stdin and writes the verdict as JSON to stdout.
 * Exits with {@value #BLOCK_EXIT_CODE} on a hard block, with the message repeated
 * on stderr for the host to show the agent. Malformed events and events that need
 * no evaluation produce no output and exit 0, leaving the decision to the host.
 */
@Command(name = "hook", mixinStandardHelpOptions = true,
        description = "Evaluate one hook event read from stdin")
@Component
public class HookCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HookCommand.class);

    public static final int BLOCK_EXIT_CODE = 2;

    @Option(names = "--phase",
            description = "Force the phase: pre-action, post-action or completion-check")
    private String phase;

    private final HookRouter router;
    private final ObjectMapper objectMapper;

    public HookCommand(HookRouter router, ObjectMapper objectMapper) {
        this.router = router;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws Exception {
        HookPhase phaseOverride = null;
        if (phase != null) {
            Optional<HookPhase> parsed = HookPhase.fromWire(phase);
            if (parsed.isEmpty()) {
                // exit 1, not picocli's usage code 2, which the host would read as a block
                System.err.println("Unknown phase '" + phase + "' (expected pre-action, post-action or completion-check)");
                return 1;
            }
            phaseOverride = parsed.get();
        }

        String input = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        Optional<Verdict> result;
        try {
            result = router.route(input, phaseOverride);
        } catch (MalformedEventException e) {
            log.warn("Declining malformed hook event: {}", e.getMessage());
            return 0;
        }
        if (result.isEmpty()) {
            return 0;
        }

        Verdict verdict = result.get();
        System.out.println(objectMapper.writeValueAsString(verdict));
        if (!verdict.approve() && verdict.hardBlock()) {
            System.err.println(verdict.message());
            return BLOCK_EXIT_CODE;
        }
        return 0;
    }
}

package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.audit.DecisionLogEntry;
import com.gatekeeper.core.audit.DecisionLogger;
import com.gatekeeper.core.model.GateType;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: gatekeeper log [--gate pre_action|completion] [--limit N]
 * <p>
 * Prints the most recent decisions of each gate, oldest first.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show recent gate decisions")
@Component
public class LogCommand implements Callable<Integer> {

    @Option(names = "--gate", description = "Gate to show: pre_action or completion (default: both)")
    private String gate;

    @Option(names = "--limit", defaultValue = "20", description = "Entries per gate (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = "--blocked", description = "Only show blocking decisions")
    private boolean blockedOnly;

    private final DecisionLogger decisionLogger;

    public LogCommand(DecisionLogger decisionLogger) {
        this.decisionLogger = decisionLogger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<GateType> gates;
        if (gate == null) {
            gates = List.of(GateType.values());
        } else {
            var match = resolveGate(gate);
            if (match == null) {
                ConsoleOutput.error("Unknown gate: " + gate + " (expected pre_action or completion)");
                return 1;
            }
            gates = List.of(match);
        }

        for (GateType type : gates) {
            List<DecisionLogEntry> entries;
            try {
                entries = decisionLogger.readRecent(type, limit);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read " + decisionLogger.fileFor(type) + ": " + e.getMessage());
                return 1;
            }
            if (blockedOnly) {
                entries = entries.stream().filter(e -> !e.approved()).toList();
            }
            ConsoleOutput.info(type.logName() + " (" + decisionLogger.fileFor(type) + ")");
            if (entries.isEmpty()) {
                System.out.println("  No decisions recorded.");
            }
            entries.forEach(ConsoleOutput::decision);
            System.out.println();
        }
        return 0;
    }

    private static GateType resolveGate(String name) {
        String normalized = name.toLowerCase(Locale.ROOT).replace('-', '_');
        for (GateType type : GateType.values()) {
            if (type.logName().equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}

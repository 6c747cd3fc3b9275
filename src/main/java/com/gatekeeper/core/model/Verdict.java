package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Output contract of every gate.
 * <p>
 * {@code approve == false} always means the host must prevent (or, for the
 * completion gate, refuse to finish) the action. {@code hardBlock} marks the
 * distinguished signal the host treats as "execution prevented"; an approving
 * verdict with a non-empty message is surfaced to the agent as guidance only.
 */
public record Verdict(
    boolean approve,
    String message,
    List<Violation> violations,
    @JsonProperty("hard_block") boolean hardBlock
) implements Serializable {

    public Verdict {
        violations = violations == null ? List.of() : List.copyOf(violations);
        message = message == null ? "" : message;
    }

    public static Verdict approve(String message) {
        return new Verdict(true, message, List.of(), false);
    }

    public static Verdict approve(String message, List<Violation> warnings) {
        return new Verdict(true, message, warnings, false);
    }

    public static Verdict block(String message, List<Violation> violations) {
        return new Verdict(false, message, violations, true);
    }

    /**
     * Resolution for faults inside the gate itself. Internal faults fail open:
     * the action proceeds and the annotation explains why nothing was checked.
     */
    public static Verdict internalFault(String gate, Throwable cause) {
        String detail = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new Verdict(true,
                "Gatekeeper " + gate + " gate failed internally and allowed the action (" + detail + ")",
                List.of(Violation.of("internal_fault", detail, Severity.ERROR)),
                false);
    }

    @JsonIgnore
    public boolean hasErrors() {
        return violations.stream().anyMatch(Violation::isError);
    }

    @JsonIgnore
    public List<String> ruleIds() {
        return violations.stream().map(Violation::ruleId).distinct().toList();
    }
}

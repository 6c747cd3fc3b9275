package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single finding produced by a classifier, a standards rule or an external tool.
 *
 * @param ruleId       stable identifier of the rule that fired (e.g. "destructive_delete")
 * @param message      human-readable description of the finding
 * @param severity     how serious the finding is
 * @param resourcePath file the finding relates to (nullable for command findings)
 * @param line         1-based line number within the resource, 0 when unknown
 * @param fix          remediation instruction (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Violation(
    @JsonProperty("rule_id") String ruleId,
    String message,
    Severity severity,
    @JsonProperty("resource_path") String resourcePath,
    int line,
    String fix
) implements Serializable {

    public static Violation of(String ruleId, String message, Severity severity) {
        return new Violation(ruleId, message, severity, null, 0, null);
    }

    public static Violation error(String ruleId, String message, String resourcePath, String fix) {
        return new Violation(ruleId, message, Severity.ERROR, resourcePath, 0, fix);
    }

    public static Violation warning(String ruleId, String message, String resourcePath) {
        return new Violation(ruleId, message, Severity.WARNING, resourcePath, 0, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** One-line rendering used in remediation messages. */
    public String describe() {
        var sb = new StringBuilder("[").append(ruleId).append("]");
        if (resourcePath != null) {
            sb.append(' ').append(resourcePath);
            if (line > 0) {
                sb.append(':').append(line);
            }
        }
        sb.append(" - ").append(message);
        return sb.toString();
    }
}

package com.gatekeeper.core.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One line of the decision log.
 *
 * @param timestamp  when the decision was made
 * @param gate       gate that decided ("pre_action" or "completion")
 * @param phase      hook phase of the request
 * @param sessionId  host session identifier (nullable)
 * @param toolName   tool the agent invoked (nullable)
 * @param request    short summary of the request
 * @param decision   "approve" or "block"
 * @param reason     verdict message
 * @param ruleIds    distinct rule ids of every violation on the verdict
 * @param durationMs evaluation time
 * @param stages     evaluation stages entered before the entry was written
 * @param mode       validation mode of a completion evaluation (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionLogEntry(
    Instant timestamp,
    String gate,
    String phase,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("tool_name") String toolName,
    String request,
    String decision,
    String reason,
    @JsonProperty("rule_ids") List<String> ruleIds,
    @JsonProperty("duration_ms") long durationMs,
    List<String> stages,
    String mode
) implements Serializable {

    public static final String APPROVE = "approve";
    public static final String BLOCK = "block";

    public DecisionLogEntry {
        ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public boolean approved() {
        return APPROVE.equals(decision);
    }
}

package com.gatekeeper.core.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Raw hook event as sent by the host on stdin or in an HTTP body.
 * Unknown fields are ignored so newer host versions keep working.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookEvent(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("tool_input") Map<String, Object> toolInput,
    String phase,
    @JsonProperty("hook_event_name") String hookEventName,
    @JsonProperty("session_id") String sessionId,
    String cwd
) {

    public HookEvent {
        toolInput = toolInput == null ? Map.of() : toolInput;
    }
}

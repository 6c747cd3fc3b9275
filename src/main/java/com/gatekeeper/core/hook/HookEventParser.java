package com.gatekeeper.core.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.HookPhase;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns raw hook JSON into an {@link ActionRequest}.
 */
@Component
public class HookEventParser {

    private static final List<String> PATH_KEYS = List.of("file_path", "path", "notebook_path");
    private static final List<String> CONTENT_KEYS = List.of("content", "new_string", "new_source");

    private final ObjectMapper objectMapper;
    private final GatekeeperProperties properties;

    public HookEventParser(ObjectMapper objectMapper, GatekeeperProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public HookEvent read(String json) throws MalformedEventException {
        if (json == null || json.isBlank()) {
            throw new MalformedEventException("Empty hook event");
        }
        try {
            HookEvent event = objectMapper.readValue(json, HookEvent.class);
            if (event == null) {
                throw new MalformedEventException("Hook event is null");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Hook event is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param phaseOverride phase forced by the caller (e.g. {@code --phase}), or null to
     *                      take it from {@code phase} or {@code hook_event_name}
     */
    public ActionRequest toRequest(HookEvent event, HookPhase phaseOverride) throws MalformedEventException {
        HookPhase phase = phaseOverride;
        if (phase == null) {
            phase = HookPhase.fromWire(event.phase())
                    .or(() -> HookPhase.fromWire(event.hookEventName()))
                    .orElseThrow(() -> new MalformedEventException(
                            "Hook event has no recognisable phase (phase=" + event.phase()
                                    + ", hook_event_name=" + event.hookEventName() + ")"));
        }
        if (phase != HookPhase.COMPLETION_CHECK && isBlank(event.toolName())) {
            throw new MalformedEventException("Hook event for " + phase.wireName() + " has no tool_name");
        }

        Map<String, Object> input = event.toolInput();
        return new ActionRequest(
                isBlank(event.toolName()) ? null : event.toolName(),
                firstString(input, PATH_KEYS),
                firstString(input, List.of("command")),
                firstString(input, CONTENT_KEYS),
                phase,
                event.sessionId(),
                properties.resolveProjectDir(event.cwd()));
    }

    public ActionRequest parse(String json, HookPhase phaseOverride) throws MalformedEventException {
        return toRequest(read(json), phaseOverride);
    }

    private static String firstString(Map<String, Object> input, List<String> keys) {
        for (String key : keys) {
            if (input.get(key) instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.gatekeeper.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Point in the agent's lifecycle at which a hook fires.
 */
public enum HookPhase {
    PRE_ACTION("pre-action"),
    POST_ACTION("post-action"),
    COMPLETION_CHECK("completion-check");

    private final String wireName;

    HookPhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Accepts the wire name ("pre-action"), the enum name ("PRE_ACTION") or a
     * host hook event name ("PreToolUse", "PostToolUse", "Stop", "SubagentStop").
     */
    public static Optional<HookPhase> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        HookPhase hostPhase = switch (v) {
            case "PreToolUse" -> PRE_ACTION;
            case "PostToolUse" -> POST_ACTION;
            case "Stop", "SubagentStop" -> COMPLETION_CHECK;
            default -> null;
        };
        if (hostPhase != null) {
            return Optional.of(hostPhase);
        }
        String normalized = v.toLowerCase(Locale.ROOT).replace('_', '-');
        for (HookPhase phase : values()) {
            if (phase.wireName.equals(normalized)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}

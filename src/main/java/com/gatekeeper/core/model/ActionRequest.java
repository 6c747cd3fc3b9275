package com.gatekeeper.core.model;

import java.nio.file.Path;

/**
 * One intercepted agent action, created per event and discarded after the decision.
 *
 * @param toolName     name of the tool the agent wants to run (nullable for completion checks)
 * @param resourcePath file the action targets (nullable)
 * @param commandText  shell command text for command tools (nullable)
 * @param content      content being written (nullable)
 * @param phase        lifecycle phase of the hook
 * @param sessionId    host session identifier (nullable)
 * @param projectDir   project root all paths are judged against
 */
public record ActionRequest(
    String toolName,
    String resourcePath,
    String commandText,
    String content,
    HookPhase phase,
    String sessionId,
    Path projectDir
) {

    public boolean hasCommand() {
        return commandText != null && !commandText.isBlank();
    }

    public boolean hasResource() {
        return resourcePath != null && !resourcePath.isBlank();
    }

    /** Short form written to the decision log. */
    public String summary() {
        var sb = new StringBuilder(phase.wireName());
        if (toolName != null) {
            sb.append(' ').append(toolName);
        }
        if (hasResource()) {
            sb.append(" path=").append(resourcePath);
        }
        if (hasCommand()) {
            String cmd = commandText.length() > 200 ? commandText.substring(0, 200) + "..." : commandText;
            sb.append(" command=").append(cmd);
        }
        return sb.toString();
    }
}

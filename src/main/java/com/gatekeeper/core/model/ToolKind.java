package com.gatekeeper.core.model;

import java.util.Set;

/**
 * Coarse grouping of host tool names by what they can do to the project.
 */
public enum ToolKind {
    FILE_WRITE,
    SHELL,
    READ_ONLY,
    OTHER;

    private static final Set<String> FILE_WRITE_TOOLS = Set.of("Write", "Edit", "MultiEdit", "NotebookEdit");
    private static final Set<String> READ_ONLY_TOOLS = Set.of(
            "Read", "Glob", "Grep", "LS", "NotebookRead", "WebFetch", "WebSearch", "TodoRead");

    public static ToolKind of(String toolName) {
        if (toolName == null) {
            return OTHER;
        }
        if (FILE_WRITE_TOOLS.contains(toolName)) {
            return FILE_WRITE;
        }
        if ("Bash".equals(toolName)) {
            return SHELL;
        }
        return READ_ONLY_TOOLS.contains(toolName) ? READ_ONLY : OTHER;
    }

    public boolean mutatesFiles() {
        return this == FILE_WRITE || this == SHELL;
    }
}

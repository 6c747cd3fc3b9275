package com.gatekeeper.core.invoker;

/**
 * Captured outcome of a {@link ToolCommand}. A non-zero exit is a result, not an exception.
 *
 * @param exitCode process exit code, or -1 when the process did not exit normally
 */
public record ToolResult(
    String name,
    ToolStatus status,
    int exitCode,
    String stdout,
    String stderr,
    long durationMs
) {

    public ToolResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ToolResult notFound(String name, String detail) {
        return new ToolResult(name, ToolStatus.NOT_FOUND, -1, "", detail, 0L);
    }

    public static ToolResult error(String name, String detail, long durationMs) {
        return new ToolResult(name, ToolStatus.ERROR, -1, "", detail, durationMs);
    }

    public boolean success() {
        return status == ToolStatus.SUCCEEDED;
    }

    /** stderr followed by stdout, whichever is non-empty. */
    public String combinedOutput() {
        if (stderr.isBlank()) {
            return stdout;
        }
        if (stdout.isBlank()) {
            return stderr;
        }
        return stderr + "\n" + stdout;
    }
}

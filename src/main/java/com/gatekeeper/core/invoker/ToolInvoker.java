package com.gatekeeper.core.invoker;

/**
 * Runs external tools. Implementations never throw: every failure, including a
 * missing executable and a timeout, comes back as a {@link ToolResult} status.
 */
@FunctionalInterface
public interface ToolInvoker {

    ToolResult run(ToolCommand command);
}

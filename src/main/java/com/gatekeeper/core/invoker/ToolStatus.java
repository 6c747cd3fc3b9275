package com.gatekeeper.core.invoker;

/**
 * How a tool run ended.
 */
public enum ToolStatus {
    SUCCEEDED,
    /** Ran to completion with a non-zero exit code. */
    FAILED,
    TIMED_OUT,
    /** Executable is not installed or not on the PATH. */
    NOT_FOUND,
    /** Could not be started or was interrupted for another reason. */
    ERROR;

    /**
     * True when the tool ran to the end, so its verdict depends only on the files
     * it saw. Timeouts, start failures and absent tools may not recur.
     */
    public boolean isConclusive() {
        return this == SUCCEEDED || this == FAILED;
    }
}

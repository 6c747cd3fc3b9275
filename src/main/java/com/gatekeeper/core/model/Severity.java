package com.gatekeeper.core.model;

/**
 * Severity of a {@link Violation}. Only {@link #ERROR} can force a block.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}

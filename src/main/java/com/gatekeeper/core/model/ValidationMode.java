package com.gatekeeper.core.model;

/**
 * Breadth over which the completion gate runs its checks.
 */
public enum ValidationMode {
    /** Every source file in the project. */
    FULL,
    /** Files changed against the last commit, plus untracked files. */
    INCREMENTAL,
    /** Exactly one file named by the request. */
    FILE_SPECIFIC
}

package com.gatekeeper.core.gate;

/**
 * Stages every gate evaluation passes through. CACHE_CHECK is skipped by gates
 * without a cache; DECIDED and LOGGED are always reached.
 */
public enum GateStage {
    RECEIVED,
    CLASSIFIED,
    CACHE_CHECK,
    VALIDATED,
    DECIDED,
    LOGGED
}

package com.gatekeeper.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Gatekeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEvaluation(String sessionId, String gate, String toolName) {
        if (sessionId != null) {
            MDC.put("sessionId", sessionId);
        }
        MDC.put("gate", gate);
        if (toolName != null) {
            MDC.put("toolName", toolName);
        }
    }

    /** Name of the external validator currently running inside a completion evaluation. */
    public static void setValidator(String validator) {
        MDC.put("validator", validator);
    }

    public static void clearValidator() {
        MDC.remove("validator");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("gate");
        MDC.remove("toolName");
        MDC.remove("validator");
    }
}

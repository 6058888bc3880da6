package com.presentos.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing router-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put("requestId", requestId);
    }

    public static void setIntent(String requestId, String intent) {
        MDC.put("requestId", requestId);
        MDC.put("intent", intent);
    }

    public static void setHandler(String handler) {
        MDC.put("handler", handler);
    }

    public static void clearHandler() {
        MDC.remove("handler");
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("intent");
        MDC.remove("handler");
    }
}

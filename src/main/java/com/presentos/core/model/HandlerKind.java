package com.presentos.core.model;

/**
 * Downstream handler services the router forwards to.
 */
public enum HandlerKind {
    CALENDAR,
    EMAIL,
    RESEARCH,
    MESSAGING,
    EXPERIENCE
}

package com.presentos.core.model;

/**
 * Normalized classification of one message. One implementation per {@link Intent}.
 * <p>
 * Every variant except {@link UnknownIntent} carries the original message as
 * {@code context} and the router's fixed {@code source} tag.
 */
public interface IntentRecord {

    Intent intent();

    String context();

    String source();

    /**
     * Whether the route's handler should be called for this record.
     */
    default boolean forwardable() {
        return true;
    }
}

package com.presentos.core.model;

/**
 * Fallback when the classifier output cannot be mapped to a known variant.
 *
 * @param raw    classifier text, kept for audit
 * @param reason why the message was not routed
 */
public record UnknownIntent(
    String raw,
    String reason,
    String context
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.UNKNOWN;
    }

    @Override
    public String source() {
        return null;
    }

    @Override
    public boolean forwardable() {
        return false;
    }
}

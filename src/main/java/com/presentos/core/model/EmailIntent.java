package com.presentos.core.model;

public record EmailIntent(
    String to,
    String subject,
    String body,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.EMAIL;
    }
}

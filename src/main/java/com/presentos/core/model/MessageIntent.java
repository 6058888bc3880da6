package com.presentos.core.model;

public record MessageIntent(
    String priority,
    String text,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.MESSAGE;
    }
}

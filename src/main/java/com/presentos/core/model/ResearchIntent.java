package com.presentos.core.model;

public record ResearchIntent(
    String topic,
    String query,
    String context,
    String source
) implements IntentRecord {

    @Override
    public Intent intent() {
        return Intent.RESEARCH;
    }
}

package com.presentos.core.model;

import java.util.Locale;

/**
 * Classified purpose of an inbound message.
 */
public enum Intent {
    TASK,
    COMPLETE_TASK,
    CALENDAR,
    EMAIL,
    RESEARCH,
    MESSAGE,
    UNKNOWN;

    /**
     * Parses a classifier label case-insensitively. Spaces and dashes count as underscores,
     * so {@code "complete task"} and {@code "Complete-Task"} both map to {@link #COMPLETE_TASK}.
     *
     * @return the matching intent, or {@link #UNKNOWN} for null, blank or unrecognized labels
     */
    public static Intent fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}

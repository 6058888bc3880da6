package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    TO_DO("To Do"),
    COMPLETED("Completed");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Anything that reads as "completed"/"done" is {@link #COMPLETED}; everything else is {@link #TO_DO}.
     */
    public static TaskStatus fromLabel(String value) {
        if (value == null) {
            return TO_DO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("completed") || normalized.equals("complete") || normalized.equals("done")
                ? COMPLETED
                : TO_DO;
    }
}

package com.presentos.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * PAEI role a task is filed under.
 */
public enum TaskRole {
    PRODUCER("Producer"),
    ADMINISTRATOR("Administrator"),
    ENTREPRENEUR("Entrepreneur"),
    INTEGRATOR("Integrator");

    private final String label;

    TaskRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return the role whose label matches case-insensitively, or {@link #PRODUCER}
     */
    public static TaskRole fromLabel(String value) {
        if (value != null) {
            for (TaskRole role : values()) {
                if (role.label.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        return PRODUCER;
    }
}

package com.presentos.core.model;

/**
 * Persisted task fields and the store property each one maps to.
 */
public enum TaskField {
    TITLE("Name", Kind.TITLE),
    RESULT("Expected Result", Kind.RICH_TEXT),
    PURPOSE("Purpose", Kind.RICH_TEXT),
    ACTION_PLAN("Action Plan", Kind.RICH_TEXT),
    ROLE("Role", Kind.SELECT),
    STATUS("Status", Kind.SELECT),
    DUE("Due Date", Kind.DATE),
    XP("XP", Kind.NUMBER),
    CREATED_AT("Created At", Kind.DATE),
    SOURCE("Source", Kind.RICH_TEXT),
    CONTEXT("Context", Kind.RICH_TEXT),
    CALENDAR_LINK("Calendar Link", Kind.URL),
    EMAIL_LINK("Email Link", Kind.URL);

    public enum Kind { TITLE, RICH_TEXT, SELECT, NUMBER, DATE, URL }

    private final String propertyName;
    private final Kind kind;

    TaskField(String propertyName, Kind kind) {
        this.propertyName = propertyName;
        this.kind = kind;
    }

    public String propertyName() {
        return propertyName;
    }

    public Kind kind() {
        return kind;
    }
}

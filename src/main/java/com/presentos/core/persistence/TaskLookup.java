package com.presentos.core.persistence;

import com.presentos.core.model.TaskRecord;

/**
 * Result of a best-effort title lookup. A lookup that could not reach the store
 * carries the failure text so callers can tell it apart from a genuine miss.
 */
public record TaskLookup(TaskRecord match, String failure) {

    public static TaskLookup found(TaskRecord match) {
        return new TaskLookup(match, null);
    }

    public static TaskLookup missing() {
        return new TaskLookup(null, null);
    }

    public static TaskLookup failed(String failure) {
        return new TaskLookup(null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}

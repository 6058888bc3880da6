package com.presentos.core.persistence;

import com.presentos.core.model.TaskField;
import com.presentos.core.model.TaskRecord;

import java.util.List;

/**
 * External document store holding task records. Implementations throw
 * {@link PersistenceException} on any failure.
 */
public interface TaskStore {

    /**
     * Creates a record and returns the identifier assigned by the store.
     */
    String create(TaskRecord record);

    /**
     * Sets a single field on an existing record, leaving every other field untouched.
     */
    void patch(String id, TaskField field, Object value);

    /**
     * Records whose title contains {@code titleText}, in store order.
     */
    List<TaskRecord> findByTitleContaining(String titleText);

    boolean isConfigured();
}

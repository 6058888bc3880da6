package com.presentos.core.persistence;

import com.presentos.core.metrics.RouterMetrics;
import com.presentos.core.model.TaskField;
import com.presentos.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Router-facing access to the {@link TaskStore} with the failure policy applied:
 * <ul>
 *   <li>{@link #create} failures propagate as {@link PersistenceException}</li>
 *   <li>{@link #patch} and {@link #findFirstByTitle} are best-effort and never throw</li>
 * </ul>
 */
@Service
public class PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private final TaskStore store;
    private final RouterMetrics metrics;

    public PersistenceGateway(TaskStore store, RouterMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * @return the store-assigned identifier
     * @throws PersistenceException if the store rejects the record or cannot be reached
     */
    public String create(TaskRecord record) {
        try {
            return store.create(record);
        } catch (PersistenceException e) {
            log.error("Task create failed for '{}': {}", record.title(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Task create failed for '{}'", record.title(), e);
            throw new PersistenceException("Task create failed: " + e.getMessage(), e);
        }
    }

    /**
     * Sets one field on a stored record.
     *
     * @return true if the store accepted the change; failures are logged and reported as false
     */
    public boolean patch(String id, TaskField field, Object value) {
        try {
            store.patch(id, field, value);
            metrics.recordPatch(field.name(), true);
            return true;
        } catch (RuntimeException e) {
            log.warn("Patch of {} on task {} failed: {}", field.propertyName(), id, e.getMessage());
            metrics.recordPatch(field.name(), false);
            return false;
        }
    }

    /**
     * First record whose title contains {@code titleText}. When several match, the store's
     * first result wins; there is no further disambiguation. Lookup failures come back as
     * {@link TaskLookup#failed}, not thrown.
     */
    public TaskLookup findFirstByTitle(String titleText) {
        try {
            List<TaskRecord> matches = store.findByTitleContaining(titleText);
            if (matches.size() > 1) {
                log.info("{} tasks match '{}'; taking the first ({})", matches.size(), titleText, matches.get(0).id());
            }
            return matches.isEmpty() ? TaskLookup.missing() : TaskLookup.found(matches.get(0));
        } catch (RuntimeException e) {
            log.warn("Task lookup for '{}' failed: {}", titleText, e.getMessage());
            return TaskLookup.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public boolean isConfigured() {
        return store.isConfigured();
    }
}

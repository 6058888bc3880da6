package com.presentos.core.routing;

import com.presentos.core.model.HandlerKind;
import com.presentos.core.model.Intent;
import com.presentos.core.model.TaskField;

/**
 * Declarative description of what the router does for one intent.
 *
 * @param persists      create a task record before forwarding
 * @param lookupByTitle find an existing record by title and mark it completed
 * @param handler       handler to forward to; null for none
 * @param linkField     field the handler's reference is patched into; null for none
 */
public record RoutePlan(
    Intent intent,
    boolean persists,
    boolean lookupByTitle,
    HandlerKind handler,
    TaskField linkField
) {

    public boolean forwards() {
        return handler != null;
    }

    /** Whether the handler call is the primary action rather than an enrichment of a stored record. */
    public boolean forwardIsPrimary() {
        return forwards() && !persists && !lookupByTitle;
    }
}

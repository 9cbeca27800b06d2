package com.workgraph.core.store;

import com.workgraph.core.model.ItemType;
import com.workgraph.core.model.Priority;

/**
 * Request to create a work item. New items always start as {@code todo}.
 *
 * @param id                   explicit id, or null to have one generated
 * @param title                title, required
 * @param priority             priority, defaults to medium
 * @param itemType             type, defaults to feature
 * @param estimatedEffortHours optional effort estimate
 */
public record NewWorkItem(
    String id,
    String title,
    Priority priority,
    ItemType itemType,
    Double estimatedEffortHours
) {

    public static NewWorkItem of(String title) {
        return new NewWorkItem(null, title, null, null, null);
    }
}

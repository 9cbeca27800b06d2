package com.workgraph.core.error;

/**
 * Thrown when a work item id is not present in the store, index or snapshot.
 */
public class NotFoundException extends WorkgraphException {

    private final String itemId;

    public NotFoundException(String itemId) {
        super("Work item not found: " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}

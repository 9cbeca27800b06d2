package com.workgraph.core.error;

/**
 * Thrown when the index cannot incorporate a change. The change has been rolled back;
 * the caller is expected to retry or rebuild the index from the store.
 */
public class IndexInconsistentException extends WorkgraphException {

    public IndexInconsistentException(String message) {
        super(message);
    }

    public IndexInconsistentException(String message, Throwable cause) {
        super(message, cause);
    }
}

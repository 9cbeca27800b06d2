package com.workgraph.core.error;

/**
 * Thrown when a write or a stored document violates the graph invariants:
 * dangling or self-blocking edges, unknown enum values, reused ids, and so on.
 * Rejected at the Store/Index boundary; never raised by analytics.
 */
public class ValidationException extends WorkgraphException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.workgraph.core.error;

/**
 * Base type for all Workgraph domain failures.
 */
public abstract class WorkgraphException extends RuntimeException {

    protected WorkgraphException(String message) {
        super(message);
    }

    protected WorkgraphException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.workgraph.core.error;

/**
 * Thrown when an analytics operation passes its caller-supplied deadline.
 */
public class AnalysisTimeoutException extends WorkgraphException {

    public AnalysisTimeoutException(String operation) {
        super("Deadline exceeded during " + operation);
    }
}

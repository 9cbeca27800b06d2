package com.workgraph.core.index;

/**
 * Why the index was rebuilt; used as a metric tag and in logs.
 */
public enum RebuildTrigger {
    STARTUP,
    MANUAL,
    RECOVERY
}

package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One entry of the ordered work queue.
 *
 * @param id        item id
 * @param title     item title
 * @param status    item status
 * @param priority  item priority
 * @param score     recommendation score; zero for items that are not ready
 * @param ready     whether the item can start now
 * @param blockedBy unfinished blockers, ascending (empty when ready)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkQueueItem(
    String id,
    String title,
    WorkItemStatus status,
    Priority priority,
    double score,
    boolean ready,
    List<String> blockedBy
) {}

package com.github.stormino.relay.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of the scheduler, safe to hand to callers.
 */
@Value
@Builder
public class SchedulerStatus {

    int queuedInteractive;
    int queuedBulk;

    List<ActiveTransfer> active;

    long totalQueued;
    long completed;
    long failed;

    /**
     * Cancelled runs. Already included in {@link #failed}.
     */
    long cancelled;

    long interactiveCompleted;
    long bulkCompleted;

    int totalSlots;
    int bulkSlots;
    int interactiveSlots;
    int freeSlots;

    /**
     * Queued task count per group context; ungrouped tasks are counted under "Unknown".
     */
    Map<String, Integer> queuedByGroup;

    public int getQueuedTotal() {
        return queuedInteractive + queuedBulk;
    }

    public long getActiveBulk() {
        return active.stream().filter(a -> a.getPriorityClass() == PriorityClass.BULK).count();
    }

    public long getActiveInteractive() {
        return active.stream().filter(a -> a.getPriorityClass() == PriorityClass.INTERACTIVE).count();
    }
}

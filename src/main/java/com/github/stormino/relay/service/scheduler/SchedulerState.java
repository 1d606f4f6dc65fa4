package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.ActiveTransfer;
import com.github.stormino.relay.model.EnqueueResult;
import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.SchedulerStatus;
import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferStatus;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.state.TransferStateMachine;
import com.github.stormino.relay.service.transfer.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Everything the scheduler mutates: both pending collections, the slot table, the dedup index
 * and the counters. Every method must be called with the scheduler lock held.
 */
@Slf4j
class SchedulerState {

    enum CancelOutcome {
        NOT_FOUND,
        REMOVED_FROM_QUEUE,
        SIGNALLED
    }

    private final TaskQueue queue = new TaskQueue();
    private final SlotAllocator slots;
    private final TransferStateMachine stateMachine;
    private final Map<String, TrackedTask> index = new HashMap<>();

    private long totalQueued;
    private long totalCompleted;
    private long totalFailed;
    private long totalCancelled;
    private long interactiveCompleted;
    private long bulkCompleted;

    SchedulerState(SlotAllocator slots, TransferStateMachine stateMachine) {
        this.slots = slots;
        this.stateMachine = stateMachine;
    }

    boolean isTracked(String taskId) {
        TrackedTask tracked = index.get(taskId);
        return tracked != null && tracked.isLive();
    }

    /**
     * Answer for an id the index already knows about, if any. A successful run whose listeners are
     * still being notified counts as complete; a failed or cancelled one may be queued again.
     */
    Optional<EnqueueResult> existingOutcome(String taskId) {
        TrackedTask tracked = index.get(taskId);
        if (tracked == null) {
            return Optional.empty();
        }
        if (tracked.isLive()) {
            return Optional.of(EnqueueResult.alreadyQueued(taskId));
        }
        TransferResult result = tracked.getResult();
        if (result.isSuccess()) {
            return Optional.of(EnqueueResult.alreadyComplete(taskId, result.getRemoteId()));
        }
        return Optional.empty();
    }

    EnqueueResult admitToQueue(TransferTask task) {
        Optional<EnqueueResult> existing = existingOutcome(task.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        queue.offer(task);
        index.put(task.getId(), new TrackedTask(task));
        totalQueued++;
        return EnqueueResult.accepted(task.getId());
    }

    /**
     * Match free slots to pending tasks until no further match is possible. Interactive work is
     * re-checked after every admission, so it is always served before any bulk task.
     */
    List<Admission> matchPending() {
        List<Admission> admissions = new ArrayList<>();
        Optional<Admission> next = admitNext();
        while (next.isPresent()) {
            admissions.add(next.get());
            next = admitNext();
        }
        return admissions;
    }

    private Optional<Admission> admitNext() {
        if (queue.hasPending(PriorityClass.INTERACTIVE)) {
            OptionalInt slotId = slots.findFree(PriorityClass.INTERACTIVE);
            if (slotId.isPresent()) {
                return queue.poll(PriorityClass.INTERACTIVE).map(task -> occupy(slotId.getAsInt(), task));
            }
        }
        if (queue.hasPending(PriorityClass.BULK)) {
            OptionalInt slotId = slots.findFree(PriorityClass.BULK);
            if (slotId.isPresent()) {
                return queue.poll(PriorityClass.BULK).map(task -> occupy(slotId.getAsInt(), task));
            }
        }
        return Optional.empty();
    }

    private Admission occupy(int slotId, TransferTask task) {
        Slot slot = slots.occupy(slotId, task);
        TrackedTask tracked = index.get(task.getId());
        CancellationToken cancellation = new CancellationToken();

        tracked.setSlotId(slotId);
        tracked.setCancellation(cancellation);
        tracked.setStatus(stateMachine.transition(task.getId(), tracked.getStatus(), TransferStatus.DOWNLOADING));

        return new Admission(slotId, slot.getKind(), task, cancellation);
    }

    void updatePhase(String taskId, TransferStatus status) {
        TrackedTask tracked = index.get(taskId);
        if (tracked != null && tracked.isRunning()) {
            tracked.setStatus(stateMachine.transition(taskId, tracked.getStatus(), status));
        }
    }

    /**
     * Release a slot and mark its task finished. The index entry is kept until {@link #forget}
     * so a duplicate request cannot slip in while the outcome is still being recorded.
     *
     * @return the finished entry, or empty if the slot had already been released for this task
     */
    Optional<TrackedTask> complete(int slotId, String taskId, TransferResult result) {
        Optional<TransferTask> released = slots.release(slotId, taskId);
        if (released.isEmpty()) {
            return Optional.empty();
        }

        TransferTask task = released.get();
        // A running task keeps its live entry until here
        TrackedTask tracked = index.get(taskId);
        tracked.setStatus(stateMachine.transition(taskId, tracked.getStatus(), result.toTransferStatus()));
        tracked.setResult(result);

        if (result.isSuccess()) {
            totalCompleted++;
            if (task.isInteractive()) {
                interactiveCompleted++;
            } else {
                bulkCompleted++;
            }
        } else {
            totalFailed++;
            if (result.isCancelled()) {
                totalCancelled++;
            }
        }
        return Optional.of(tracked);
    }

    /**
     * Drop a finished entry from the dedup index. An entry that has since been replaced by a new
     * request for the same id is left alone.
     */
    void forget(TrackedTask finished) {
        index.remove(finished.getTask().getId(), finished);
    }

    CancelOutcome cancel(String taskId) {
        TrackedTask tracked = index.get(taskId);
        if (tracked == null || tracked.isFinished()) {
            return CancelOutcome.NOT_FOUND;
        }

        if (tracked.isRunning()) {
            tracked.getCancellation().cancel();
            return CancelOutcome.SIGNALLED;
        }

        queue.remove(taskId);
        index.remove(taskId);
        return CancelOutcome.REMOVED_FROM_QUEUE;
    }

    /**
     * Signal cancellation to every running transfer.
     *
     * @return number of transfers signalled
     */
    int cancelAllRunning() {
        int signalled = 0;
        for (TrackedTask tracked : index.values()) {
            if (tracked.isRunning() && tracked.getCancellation().cancel()) {
                signalled++;
            }
        }
        return signalled;
    }

    Optional<TransferStatus> statusOf(String taskId) {
        return Optional.ofNullable(index.get(taskId)).map(TrackedTask::getStatus);
    }

    SchedulerStatus snapshot() {
        List<ActiveTransfer> active = new ArrayList<>();
        for (Slot slot : slots.occupiedSlots()) {
            TransferTask task = slot.getOccupant();
            TrackedTask tracked = index.get(task.getId());
            active.add(new ActiveTransfer(
                    slot.getId(),
                    slot.getKind(),
                    task.getId(),
                    task.getDisplayName(),
                    task.getPriorityClass(),
                    task.getGroupContext(),
                    tracked != null ? tracked.getStatus() : TransferStatus.DOWNLOADING,
                    slot.getOccupiedAt()));
        }

        return SchedulerStatus.builder()
                .queuedInteractive(queue.size(PriorityClass.INTERACTIVE))
                .queuedBulk(queue.size(PriorityClass.BULK))
                .active(active)
                .totalQueued(totalQueued)
                .completed(totalCompleted)
                .failed(totalFailed)
                .cancelled(totalCancelled)
                .interactiveCompleted(interactiveCompleted)
                .bulkCompleted(bulkCompleted)
                .totalSlots(slots.getTotalSlots())
                .bulkSlots(slots.getBulkSlots())
                .interactiveSlots(slots.getInteractiveSlots())
                .freeSlots(slots.getFreeSlotCount())
                .queuedByGroup(queuedByGroup())
                .build();
    }

    private Map<String, Integer> queuedByGroup() {
        Map<String, Integer> groups = new LinkedHashMap<>();
        for (PriorityClass priorityClass : PriorityClass.values()) {
            for (TransferTask task : queue.snapshot(priorityClass)) {
                String group = task.getGroupContext() != null ? task.getGroupContext() : "Unknown";
                groups.merge(group, 1, Integer::sum);
            }
        }
        return groups;
    }

    List<TransferTask> queued(PriorityClass priorityClass) {
        return queue.snapshot(priorityClass);
    }

    SlotAllocator getSlots() {
        return slots;
    }
}

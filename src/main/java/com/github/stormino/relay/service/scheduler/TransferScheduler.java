package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.model.EnqueueResult;
import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.SchedulerStatus;
import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferStatus;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.registry.DedupProbe;
import com.github.stormino.relay.service.state.TransferStateMachine;
import com.github.stormino.relay.service.transfer.TransferExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority-aware admission control for transfers.
 * <p>
 * A single lock guards the queue, the slot table and the dedup index; enqueue, cancel,
 * dequeue-and-occupy and complete-and-release are each atomic with respect to one another.
 * Transfers themselves run on the slot executor, outside the lock. The loop thread wakes on
 * every enqueue, cancel and completion, and at least every {@code idleWakeMillis}.
 */
@Slf4j
@Service
public class TransferScheduler implements SmartLifecycle {

    private final TransferExecutor transferExecutor;
    private final Executor slotExecutor;
    private final DedupProbe dedupProbe;
    private final List<TransferCompletionListener> completionListeners;
    private final long idleWakeMillis;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private final SchedulerState state;

    private boolean wakeRequested;
    private volatile boolean running;
    private Thread loopThread;

    public TransferScheduler(RelayProperties properties,
                             TransferExecutor transferExecutor,
                             @Qualifier("transferExecutor") Executor slotExecutor,
                             DedupProbe dedupProbe,
                             TransferStateMachine stateMachine,
                             List<TransferCompletionListener> completionListeners) {
        this.transferExecutor = transferExecutor;
        this.slotExecutor = slotExecutor;
        this.dedupProbe = dedupProbe;
        this.completionListeners = completionListeners;
        this.idleWakeMillis = properties.getScheduler().getIdleWakeMillis();

        SlotAllocator slots = new SlotAllocator(
                properties.getScheduler().getBulkSlots(),
                properties.getScheduler().getInteractiveSlots());
        this.state = new SchedulerState(slots, stateMachine);
    }

    /**
     * Queue a transfer unless it is already live or already durably stored.
     */
    public EnqueueResult enqueue(TransferTask task) {
        lock.lock();
        try {
            Optional<EnqueueResult> existing = state.existingOutcome(task.getId());
            if (existing.isPresent()) {
                log.info("Transfer already {}: {} [{}]",
                        existing.get().getOutcome() == EnqueueResult.Outcome.ALREADY_COMPLETE ? "completed" : "queued or running",
                        task.getDisplayName(), task.getId());
                return existing.get();
            }
        } finally {
            lock.unlock();
        }

        // The probe may hit the network, so it runs outside the lock
        Optional<String> storedAs = probe(task);
        if (storedAs.isPresent()) {
            log.info("Transfer already stored: {} [{}] as {}", task.getDisplayName(), task.getId(), storedAs.get());
            return EnqueueResult.alreadyComplete(task.getId(), storedAs.get());
        }

        EnqueueResult result;
        lock.lock();
        try {
            result = state.admitToQueue(task);
            if (result.isAccepted()) {
                requestWake();
            }
        } finally {
            lock.unlock();
        }

        if (result.isAccepted()) {
            log.info("{} transfer queued: {} [{}]{}",
                    task.getPriorityClass().getDisplayName(), task.getDisplayName(), task.getId(),
                    task.getGroupContext() != null ? " (" + task.getGroupContext() + ")" : "");
        }
        return result;
    }

    private Optional<String> probe(TransferTask task) {
        try {
            return dedupProbe.isDurablyStored(task.getId());
        } catch (RuntimeException e) {
            log.warn("Dedup probe failed for {}, queueing anyway: {}", task.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Remove a queued transfer, or ask a running one to stop.
     *
     * @return false if no live transfer has this id
     */
    public boolean cancel(String taskId) {
        SchedulerState.CancelOutcome outcome;
        lock.lock();
        try {
            outcome = state.cancel(taskId);
            if (outcome != SchedulerState.CancelOutcome.NOT_FOUND) {
                requestWake();
            }
        } finally {
            lock.unlock();
        }

        switch (outcome) {
            case REMOVED_FROM_QUEUE:
                log.info("Removed from queue: {}", taskId);
                return true;
            case SIGNALLED:
                log.info("Cancellation requested for running transfer: {}", taskId);
                return true;
            default:
                return false;
        }
    }

    public SchedulerStatus status() {
        lock.lock();
        try {
            return state.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public boolean isInProgress(String taskId) {
        lock.lock();
        try {
            return state.isTracked(taskId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<TransferStatus> statusOf(String taskId) {
        lock.lock();
        try {
            return state.statusOf(taskId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Match every free slot it can to pending work and launch the admitted transfers.
     *
     * @return number of transfers launched
     */
    public int dispatchPending() {
        List<Admission> admissions;
        lock.lock();
        try {
            admissions = state.matchPending();
        } finally {
            lock.unlock();
        }

        for (Admission admission : admissions) {
            launch(admission);
        }
        if (!admissions.isEmpty()) {
            logDetailedStatus();
        }
        return admissions.size();
    }

    private void launch(Admission admission) {
        TransferTask task = admission.getTask();
        log.info("[Slot {}] Starting {} transfer ({} slot): {} [{}]",
                admission.getSlotId(), task.getPriorityClass().getDisplayName(),
                admission.getSlotKind(), task.getDisplayName(), task.getId());
        try {
            slotExecutor.execute(() -> runInSlot(admission));
        } catch (RejectedExecutionException e) {
            log.error("[Slot {}] Executor rejected transfer {}: {}",
                    admission.getSlotId(), task.getId(), e.getMessage(), e);
            finish(admission, TransferResult.failure(
                    TransferResult.FailureReason.INTERNAL_ERROR, "Transfer could not be started", e));
        }
    }

    private void runInSlot(Admission admission) {
        TransferTask task = admission.getTask();
        TransferResult result = null;
        try {
            result = transferExecutor.run(task, admission.getCancellation(),
                    phase -> updatePhase(task.getId(), phase));
        } catch (Exception e) {
            log.error("[Slot {}] Transfer {} failed unexpectedly: {}",
                    admission.getSlotId(), task.getId(), e.getMessage(), e);
            result = TransferResult.failure(TransferResult.FailureReason.INTERNAL_ERROR, e.getMessage(), e);
        } finally {
            finish(admission, result != null ? result : TransferResult.failure(
                    TransferResult.FailureReason.INTERNAL_ERROR, "Transfer ended without a result"));
        }
    }

    private void updatePhase(String taskId, TransferStatus phase) {
        lock.lock();
        try {
            state.updatePhase(taskId, phase);
        } finally {
            lock.unlock();
        }
    }

    private void finish(Admission admission, TransferResult result) {
        TransferTask task = admission.getTask();
        Optional<TrackedTask> finished;
        lock.lock();
        try {
            finished = state.complete(admission.getSlotId(), task.getId(), result);
            requestWake();
        } finally {
            lock.unlock();
        }

        if (finished.isEmpty()) {
            return;
        }

        if (result.isSuccess()) {
            log.info("[Slot {}] {} transfer completed: {} [{}] -> {}",
                    admission.getSlotId(), task.getPriorityClass().getDisplayName(),
                    task.getDisplayName(), task.getId(), result.getRemoteId());
        } else if (result.isCancelled()) {
            log.info("[Slot {}] Transfer cancelled: {} [{}]",
                    admission.getSlotId(), task.getDisplayName(), task.getId());
        } else {
            log.warn("[Slot {}] Transfer failed: {} [{}] ({}: {})",
                    admission.getSlotId(), task.getDisplayName(), task.getId(),
                    result.getFailureReason(), result.getErrorMessage());
        }

        for (TransferCompletionListener listener : completionListeners) {
            try {
                listener.onTransferFinished(task, admission.getSlotId(), result);
            } catch (Exception e) {
                log.error("Error in completion listener for task {}: {}", task.getId(), e.getMessage(), e);
            }
        }

        // Only now may the id be requested again: the outcome has been recorded everywhere
        lock.lock();
        try {
            state.forget(finished.get());
        } finally {
            lock.unlock();
        }
        logDetailedStatus();
    }

    // Caller holds the lock
    private void requestWake() {
        wakeRequested = true;
        wake.signalAll();
    }

    private void runLoop() {
        log.info("Transfer scheduler loop started");
        while (running) {
            try {
                dispatchPending();
            } catch (RuntimeException e) {
                log.error("Error in scheduler loop: {}", e.getMessage(), e);
            }

            try {
                awaitWake();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Transfer scheduler loop stopped");
    }

    private void awaitWake() throws InterruptedException {
        lock.lock();
        try {
            if (!wakeRequested && running) {
                wake.await(idleWakeMillis, TimeUnit.MILLISECONDS);
            }
            wakeRequested = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            loopThread = new Thread(this::runLoop, "transfer-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        Thread thread;
        int signalled;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            signalled = state.cancelAllRunning();
            requestWake();
            thread = loopThread;
            loopThread = null;
        } finally {
            lock.unlock();
        }

        if (signalled > 0) {
            log.info("Signalled cancellation to {} running transfer(s)", signalled);
        }
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void logDetailedStatus() {
        if (!log.isDebugEnabled()) {
            return;
        }
        List<TransferTask> interactive;
        List<TransferTask> bulk;
        SchedulerStatus status;
        lock.lock();
        try {
            status = state.snapshot();
            interactive = state.queued(PriorityClass.INTERACTIVE);
            bulk = state.queued(PriorityClass.BULK);
        } finally {
            lock.unlock();
        }

        StringBuilder sb = new StringBuilder(String.format("Scheduler status: %d queued, %d active (interactive %d, bulk %d)%n",
                status.getQueuedTotal(), status.getActive().size(), status.getActiveInteractive(), status.getActiveBulk()));
        if (status.getActive().isEmpty()) {
            sb.append("  Active: none\n");
        } else {
            status.getActive().forEach(a -> sb.append(String.format("  [Slot %d] %s (%s slot) %s %s%n",
                    a.getSlotId(), a.getPriorityClass(), a.getSlotKind(), a.getStatus(), a.getDisplayName())));
        }
        sb.append(String.format("  Interactive queue (%d): ", interactive.size()));
        interactive.stream().limit(5).forEach(t -> sb.append(t.getDisplayName()).append(' '));
        sb.append(String.format("%n  Bulk queue (%d) by group: %s%n", bulk.size(), status.getQueuedByGroup()));
        sb.append(String.format("  Completed: %d (interactive %d, bulk %d), failed: %d, free slots: %d/%d",
                status.getCompleted(), status.getInteractiveCompleted(), status.getBulkCompleted(),
                status.getFailed(), status.getFreeSlots(), status.getTotalSlots()));
        log.debug(sb.toString());
    }
}

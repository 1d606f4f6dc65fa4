package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferStatus;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.transfer.CancellationToken;
import lombok.Getter;
import lombok.Setter;

/**
 * Dedup index entry: a live task, queued or occupying a slot. A finished entry stays in the index,
 * holding its result, until the completion listeners have run.
 */
@Getter
@Setter
class TrackedTask {

    private final TransferTask task;
    private TransferStatus status = TransferStatus.QUEUED;
    private Integer slotId;
    private CancellationToken cancellation;
    private TransferResult result;

    TrackedTask(TransferTask task) {
        this.task = task;
    }

    boolean isRunning() {
        return slotId != null && result == null;
    }

    boolean isFinished() {
        return result != null;
    }

    boolean isLive() {
        return result == null;
    }
}

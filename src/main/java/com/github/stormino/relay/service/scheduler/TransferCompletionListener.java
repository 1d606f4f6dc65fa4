package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferTask;

/**
 * Notified after a slot has been released, outside the scheduler lock.
 */
public interface TransferCompletionListener {

    void onTransferFinished(TransferTask task, int slotId, TransferResult result);
}

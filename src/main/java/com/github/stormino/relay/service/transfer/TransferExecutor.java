package com.github.stormino.relay.service.transfer;

import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferStatus;
import com.github.stormino.relay.model.TransferTask;

import java.util.function.Consumer;

/**
 * Runs one transfer end-to-end inside an occupied slot.
 */
public interface TransferExecutor {

    /**
     * Implementations report every outcome, including cancellation, through the returned result.
     *
     * @param task Task to run
     * @param cancellation Polled between chunk reads
     * @param phaseListener Told when the run moves from downloading to uploading
     */
    TransferResult run(TransferTask task, CancellationToken cancellation, Consumer<TransferStatus> phaseListener);
}

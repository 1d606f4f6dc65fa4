package com.github.stormino.relay.model;

import lombok.Value;

/**
 * Answer to an enqueue request. Duplicates and already-stored objects are reported here,
 * not raised as errors.
 */
@Value
public class EnqueueResult {

    Outcome outcome;
    String taskId;

    /**
     * Existing durable identifier, set only for {@link Outcome#ALREADY_COMPLETE}.
     */
    String remoteId;

    public enum Outcome {
        ACCEPTED,
        ALREADY_QUEUED,
        ALREADY_COMPLETE
    }

    public static EnqueueResult accepted(String taskId) {
        return new EnqueueResult(Outcome.ACCEPTED, taskId, null);
    }

    public static EnqueueResult alreadyQueued(String taskId) {
        return new EnqueueResult(Outcome.ALREADY_QUEUED, taskId, null);
    }

    public static EnqueueResult alreadyComplete(String taskId, String remoteId) {
        return new EnqueueResult(Outcome.ALREADY_COMPLETE, taskId, remoteId);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}

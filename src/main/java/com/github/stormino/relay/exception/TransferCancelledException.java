package com.github.stormino.relay.exception;

/**
 * Thrown inside an executor when its cancellation token has been signalled.
 */
public class TransferCancelledException extends TransferException {

    private final String taskId;

    public TransferCancelledException(String taskId) {
        super("Transfer cancelled: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

package com.github.stormino.relay.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one transfer run. Executors report failures through this type instead of throwing
 * past the slot boundary.
 */
@Value
@Builder
public class TransferResult {

    ResultStatus status;

    /**
     * Durable identifier returned by the sink. Only set on success.
     */
    String remoteId;

    FailureReason failureReason;

    String errorMessage;

    Throwable cause;

    long bytesTransferred;

    public enum ResultStatus {
        SUCCESS,
        FAILED,
        /**
         * Stopped on request. Kept apart from FAILED so callers can tell "we asked it to stop"
         * from "it broke".
         */
        CANCELLED
    }

    public enum FailureReason {
        SOURCE_UNAVAILABLE,
        SOURCE_READ_ERROR,
        STAGING_ERROR,
        SINK_UPLOAD_ERROR,
        INTERNAL_ERROR
    }

    public static TransferResult success(String remoteId, long bytesTransferred) {
        return TransferResult.builder()
                .status(ResultStatus.SUCCESS)
                .remoteId(remoteId)
                .bytesTransferred(bytesTransferred)
                .build();
    }

    public static TransferResult failure(FailureReason reason, String errorMessage) {
        return failure(reason, errorMessage, null);
    }

    public static TransferResult failure(FailureReason reason, String errorMessage, Throwable cause) {
        return TransferResult.builder()
                .status(ResultStatus.FAILED)
                .failureReason(reason)
                .errorMessage(errorMessage)
                .cause(cause)
                .build();
    }

    public static TransferResult cancelled(String message) {
        return TransferResult.builder()
                .status(ResultStatus.CANCELLED)
                .errorMessage(message)
                .build();
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    public boolean isCancelled() {
        return status == ResultStatus.CANCELLED;
    }

    public TransferStatus toTransferStatus() {
        switch (status) {
            case SUCCESS:
                return TransferStatus.COMPLETED;
            case CANCELLED:
                return TransferStatus.CANCELLED;
            default:
                return TransferStatus.FAILED;
        }
    }
}

package com.github.stormino.relay.exception;

/**
 * Thrown when the transfer sink rejects or fails an upload.
 */
public class SinkUploadException extends TransferException {

    private final String displayName;
    private final Integer httpStatus;

    public SinkUploadException(String message, String displayName) {
        super(message);
        this.displayName = displayName;
        this.httpStatus = null;
    }

    public SinkUploadException(String message, String displayName, Integer httpStatus) {
        super(message);
        this.displayName = displayName;
        this.httpStatus = httpStatus;
    }

    public SinkUploadException(String message, Throwable cause, String displayName) {
        super(message, cause);
        this.displayName = displayName;
        this.httpStatus = null;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}

package com.github.stormino.relay.exception;

/**
 * Root of the relay's failures. Executors translate these into a {@link
 * com.github.stormino.relay.model.TransferResult}; nothing of this type escapes a slot.
 */
public class TransferException extends RuntimeException {

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}

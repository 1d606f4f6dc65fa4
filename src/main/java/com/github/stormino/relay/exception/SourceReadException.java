package com.github.stormino.relay.exception;

/**
 * Thrown when reading a chunk from the transfer source fails part-way through a transfer.
 */
public class SourceReadException extends TransferException {

    private final String locator;
    private final long position;

    public SourceReadException(String message, String locator, long position) {
        super(message);
        this.locator = locator;
        this.position = position;
    }

    public SourceReadException(String message, Throwable cause, String locator, long position) {
        super(message, cause);
        this.locator = locator;
        this.position = position;
    }

    public String getLocator() {
        return locator;
    }

    public long getPosition() {
        return position;
    }
}

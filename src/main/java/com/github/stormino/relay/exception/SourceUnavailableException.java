package com.github.stormino.relay.exception;

/**
 * Thrown when the transfer source cannot locate or open an object.
 */
public class SourceUnavailableException extends TransferException {

    private final String locator;

    public SourceUnavailableException(String message, String locator) {
        super(message);
        this.locator = locator;
    }

    public SourceUnavailableException(String message, Throwable cause, String locator) {
        super(message, cause);
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}

package com.github.stormino.relay.model;

import lombok.Getter;
import lombok.NonNull;

/**
 * An opened object on the transfer source. Tracks the read position of a single transfer run,
 * so a handle must not be shared between runs.
 */
@Getter
public class ObjectHandle {

    public static final long UNKNOWN_SIZE = -1L;

    private final ObjectLocator locator;
    private final long sizeBytes;
    private long position;

    public ObjectHandle(@NonNull ObjectLocator locator, long sizeBytes) {
        this.locator = locator;
        this.sizeBytes = sizeBytes > 0 ? sizeBytes : UNKNOWN_SIZE;
    }

    /**
     * A reported size of zero counts as unknown; completion is then signalled by end-of-stream.
     */
    public boolean isSizeKnown() {
        return sizeBytes > 0;
    }

    public void advance(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Cannot advance by a negative byte count: " + bytes);
        }
        position += bytes;
    }

    public long getRemainingBytes() {
        return isSizeKnown() ? Math.max(0, sizeBytes - position) : UNKNOWN_SIZE;
    }
}

package com.github.stormino.relay.service.source;

import com.github.stormino.relay.exception.SourceReadException;
import com.github.stormino.relay.exception.SourceUnavailableException;
import com.github.stormino.relay.model.ObjectHandle;
import com.github.stormino.relay.model.ObjectLocator;

import java.util.Optional;

/**
 * Remote origin of relayed objects.
 */
public interface TransferSource {

    /**
     * Locate an object and report its size.
     *
     * @throws SourceUnavailableException if the object cannot be found or opened
     */
    ObjectHandle resolve(ObjectLocator locator);

    /**
     * Read the next chunk at the handle's position and advance the handle past it.
     * A chunk may be shorter than requested.
     *
     * @param handle Handle from {@link #resolve}
     * @param chunkSizeBytes Requested chunk size
     * @return The bytes read, or empty at end-of-stream
     * @throws SourceReadException on transport failure or an unexpected response
     */
    Optional<byte[]> readChunk(ObjectHandle handle, int chunkSizeBytes);
}

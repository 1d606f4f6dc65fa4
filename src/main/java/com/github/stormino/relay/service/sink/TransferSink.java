package com.github.stormino.relay.service.sink;

import com.github.stormino.relay.exception.SinkUploadException;

import java.nio.file.Path;

/**
 * Remote blob storage that relayed objects are re-hosted on.
 */
public interface TransferSink {

    /**
     * Upload a staged file.
     *
     * @param stagingFile Local file holding the complete object
     * @param displayName Name the object is stored under
     * @return Durable remote identifier
     * @throws SinkUploadException if the sink rejects or fails the upload
     */
    String upload(Path stagingFile, String displayName);

    /**
     * Check whether a previously returned identifier still resolves.
     */
    boolean exists(String remoteId);
}

package com.github.stormino.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of an object that has been re-hosted on the sink.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {
    private String id;
    private String remoteId;
    private String displayName;
    private long sizeBytes;
    private Instant uploadedAt;
}

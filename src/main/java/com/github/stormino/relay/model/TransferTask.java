package com.github.stormino.relay.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One requested object transfer. Immutable once queued.
 */
@Value
@Builder
public class TransferTask {

    /**
     * Identifier of the remote object; unique key for dedup and lookup.
     */
    @NonNull
    String id;

    @NonNull
    ObjectLocator locator;

    @NonNull
    String displayName;

    @NonNull
    PriorityClass priorityClass;

    @NonNull
    @Builder.Default
    Instant enqueuedAt = Instant.now();

    /**
     * Series or collection name. Only used to group status output.
     */
    String groupContext;

    public boolean isInteractive() {
        return priorityClass == PriorityClass.INTERACTIVE;
    }
}

package com.github.stormino.relay.service.registry;

import java.util.Optional;

/**
 * Consulted before queueing, to skip objects that are already durably stored.
 */
@FunctionalInterface
public interface DedupProbe {

    /**
     * @param id Object identifier
     * @return Remote identifier of the stored copy, or empty if the object still needs relaying
     */
    Optional<String> isDurablyStored(String id);
}

package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.SlotKind;
import com.github.stormino.relay.model.TransferTask;
import lombok.Getter;

import java.time.Instant;

/**
 * One unit of execution concurrency. Idle when it has no occupant.
 */
@Getter
public class Slot {

    private final int id;
    private final SlotKind kind;
    private TransferTask occupant;
    private Instant occupiedAt;

    Slot(int id, SlotKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public boolean isIdle() {
        return occupant == null;
    }

    void occupy(TransferTask task) {
        if (occupant != null) {
            throw new IllegalStateException(String.format(
                    "Slot %d is already occupied by %s", id, occupant.getId()));
        }
        this.occupant = task;
        this.occupiedAt = Instant.now();
    }

    TransferTask vacate() {
        TransferTask previous = occupant;
        occupant = null;
        occupiedAt = null;
        return previous;
    }
}

package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.SlotKind;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.transfer.CancellationToken;
import lombok.Value;

/**
 * A task matched to a slot, ready to be launched.
 */
@Value
public class Admission {
    int slotId;
    SlotKind slotKind;
    TransferTask task;
    CancellationToken cancellation;
}

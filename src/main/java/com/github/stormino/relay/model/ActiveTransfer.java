package com.github.stormino.relay.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ActiveTransfer {
    int slotId;
    SlotKind slotKind;
    String taskId;
    String displayName;
    PriorityClass priorityClass;
    String groupContext;
    TransferStatus status;
    Instant startedAt;
}

package com.github.stormino.relay.model;

public enum SlotKind {
    BULK_RESERVED,
    INTERACTIVE_RESERVED;

    /**
     * Whether a task of the given class may occupy an idle slot of this kind.
     * Interactive work may borrow bulk capacity, never the other way round.
     */
    public boolean accepts(PriorityClass priorityClass) {
        return this == BULK_RESERVED || priorityClass == PriorityClass.INTERACTIVE;
    }
}

package com.github.stormino.relay.model;

/**
 * Admission class of a transfer, fixed when the task is queued.
 */
public enum PriorityClass {
    /**
     * Latency-sensitive request, e.g. a single episode someone is about to play.
     */
    INTERACTIVE("Interactive"),

    /**
     * Part of a larger batch such as a whole season; tolerant of delay.
     */
    BULK("Bulk");

    private final String displayName;

    PriorityClass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

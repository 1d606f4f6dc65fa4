package com.github.stormino.relay.model;

public enum TransferStatus {
    QUEUED("Queued"),
    DOWNLOADING("Downloading"),
    UPLOADING("Uploading"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    TransferStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

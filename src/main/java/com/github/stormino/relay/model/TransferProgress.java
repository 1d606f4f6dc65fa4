package com.github.stormino.relay.model;

import lombok.Getter;

/**
 * Progress of one running transfer. Owned by the executor thread running it.
 */
@Getter
public class TransferProgress {

    private final long totalBytes;
    private final long startedAtNanos;
    private long bytesTransferred;
    private int currentChunkSize;
    private double peakThroughput;

    public TransferProgress(long totalBytes, int initialChunkSize, long startedAtNanos) {
        this.totalBytes = totalBytes;
        this.currentChunkSize = initialChunkSize;
        this.startedAtNanos = startedAtNanos;
    }

    public void addBytes(long bytes) {
        bytesTransferred += bytes;
    }

    public void setCurrentChunkSize(int chunkSize) {
        this.currentChunkSize = chunkSize;
    }

    /**
     * Record the throughput of a closed sampling window, in bytes per second.
     */
    public void recordSample(double bytesPerSecond) {
        peakThroughput = Math.max(peakThroughput, bytesPerSecond);
    }

    public Double getPercentage() {
        if (totalBytes <= 0) {
            return null;
        }
        return Math.min(100.0, (bytesTransferred * 100.0) / totalBytes);
    }

    public double getAverageThroughput(long nowNanos) {
        double seconds = (nowNanos - startedAtNanos) / 1_000_000_000.0;
        return seconds > 0 ? bytesTransferred / seconds : 0.0;
    }
}

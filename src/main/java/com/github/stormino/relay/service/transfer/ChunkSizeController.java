package com.github.stormino.relay.service.transfer;

import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.exception.ConfigurationException;
import com.github.stormino.relay.util.SizeFormat;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Throughput-driven chunk sizing for a single transfer run.
 * <p>
 * Bytes are accumulated into fixed wall-clock sampling windows. When a window has elapsed the
 * observed throughput is classified and the chunk size is doubled (above the high threshold) or
 * halved (below the low threshold), always within {@code [min, max]}. A window that has not fully
 * elapsed is never evaluated, so the tail of a transfer cannot trigger an adjustment.
 * <p>
 * Not thread-safe; owned by the executor thread running the transfer.
 */
public class ChunkSizeController {

    public enum ThroughputBand {
        /** Below the low threshold, chunk size shrinks. */
        SLOW,
        MODERATE,
        OPTIMAL,
        /** Above the high threshold, chunk size grows. */
        FAST
    }

    @Value
    public static class WindowSample {
        double bytesPerSecond;
        ThroughputBand band;
        int previousChunkSize;
        int chunkSize;
        long windowNanos;

        public boolean isAdjusted() {
            return chunkSize != previousChunkSize;
        }
    }

    @Getter
    private final int minChunkSize;
    @Getter
    private final int maxChunkSize;
    private final double lowBytesPerSecond;
    private final double mediumBytesPerSecond;
    private final double highBytesPerSecond;
    private final long windowNanos;

    @Getter
    private int currentChunkSize;
    private long windowStartNanos;
    private long bytesThisWindow;

    public ChunkSizeController(int minChunkSize, int initialChunkSize, int maxChunkSize,
                               double lowBytesPerSecond, double mediumBytesPerSecond, double highBytesPerSecond,
                               long windowNanos) {
        if (minChunkSize <= 0 || minChunkSize > maxChunkSize) {
            throw new ConfigurationException("Chunk size bounds are invalid: min " + minChunkSize + ", max " + maxChunkSize,
                    "relay.transfer.min-chunk-size", String.valueOf(minChunkSize));
        }
        if (initialChunkSize < minChunkSize || initialChunkSize > maxChunkSize) {
            throw new ConfigurationException("Default chunk size must lie within [min, max]: " + initialChunkSize,
                    "relay.transfer.default-chunk-size", String.valueOf(initialChunkSize));
        }
        if (lowBytesPerSecond > mediumBytesPerSecond || mediumBytesPerSecond > highBytesPerSecond) {
            throw new ConfigurationException("Throughput thresholds must satisfy low <= medium <= high",
                    "relay.transfer.low-throughput-mbps", String.valueOf(SizeFormat.toMibPerSecond(lowBytesPerSecond)));
        }
        if (windowNanos <= 0) {
            throw new ConfigurationException("Sampling window must be positive",
                    "relay.transfer.sample-window-seconds", String.valueOf(windowNanos));
        }
        this.minChunkSize = minChunkSize;
        this.maxChunkSize = maxChunkSize;
        this.currentChunkSize = initialChunkSize;
        this.lowBytesPerSecond = lowBytesPerSecond;
        this.mediumBytesPerSecond = mediumBytesPerSecond;
        this.highBytesPerSecond = highBytesPerSecond;
        this.windowNanos = windowNanos;
    }

    public static ChunkSizeController fromProperties(RelayProperties.Transfer transfer) {
        return new ChunkSizeController(
                transfer.getMinChunkSize(),
                transfer.getDefaultChunkSize(),
                transfer.getMaxChunkSize(),
                SizeFormat.fromMibPerSecond(transfer.getLowThroughputMbps()),
                SizeFormat.fromMibPerSecond(transfer.getMediumThroughputMbps()),
                SizeFormat.fromMibPerSecond(transfer.getHighThroughputMbps()),
                TimeUnit.SECONDS.toNanos(transfer.getSampleWindowSeconds()));
    }

    /**
     * Open the first sampling window.
     */
    public void start(long nowNanos) {
        windowStartNanos = nowNanos;
        bytesThisWindow = 0;
    }

    /**
     * Account for bytes just staged. Evaluates and resets the window once it has elapsed.
     *
     * @return the closed window, if this call closed one
     */
    public Optional<WindowSample> record(long bytes, long nowNanos) {
        bytesThisWindow += bytes;

        long elapsed = nowNanos - windowStartNanos;
        if (elapsed < windowNanos) {
            return Optional.empty();
        }

        double bytesPerSecond = bytesThisWindow / (elapsed / 1_000_000_000.0);
        ThroughputBand band = classify(bytesPerSecond);
        int previous = currentChunkSize;

        if (band == ThroughputBand.FAST && currentChunkSize < maxChunkSize) {
            currentChunkSize = (int) Math.min((long) currentChunkSize * 2, maxChunkSize);
        } else if (band == ThroughputBand.SLOW && currentChunkSize > minChunkSize) {
            currentChunkSize = Math.max(currentChunkSize / 2, minChunkSize);
        }

        windowStartNanos = nowNanos;
        bytesThisWindow = 0;
        return Optional.of(new WindowSample(bytesPerSecond, band, previous, currentChunkSize, elapsed));
    }

    public ThroughputBand classify(double bytesPerSecond) {
        if (bytesPerSecond > highBytesPerSecond) {
            return ThroughputBand.FAST;
        }
        if (bytesPerSecond < lowBytesPerSecond) {
            return ThroughputBand.SLOW;
        }
        return bytesPerSecond >= mediumBytesPerSecond ? ThroughputBand.OPTIMAL : ThroughputBand.MODERATE;
    }
}

package com.github.stormino.relay.util;

import lombok.experimental.UtilityClass;

/**
 * Binary-unit formatting for chunk sizes, byte counts and throughput.
 */
@UtilityClass
public class SizeFormat {

    public static final long BYTES_PER_KIB = 1024L;
    public static final long BYTES_PER_MIB = 1024L * 1024;
    public static final long BYTES_PER_GIB = 1024L * 1024 * 1024;

    /**
     * Format a byte count, e.g. "512 B", "4.0 KiB", "12.5 MiB", "1.20 GiB".
     */
    public static String formatBytes(long bytes) {
        if (bytes < 0) {
            return "unknown";
        }
        if (bytes >= BYTES_PER_GIB) {
            return String.format("%.2f GiB", (double) bytes / BYTES_PER_GIB);
        }
        if (bytes >= BYTES_PER_MIB) {
            return String.format("%.1f MiB", (double) bytes / BYTES_PER_MIB);
        }
        if (bytes >= BYTES_PER_KIB) {
            return String.format("%.1f KiB", (double) bytes / BYTES_PER_KIB);
        }
        return bytes + " B";
    }

    public static String formatThroughput(double bytesPerSecond) {
        if (bytesPerSecond <= 0) {
            return "0 B/s";
        }
        return formatBytes((long) bytesPerSecond) + "/s";
    }

    public static double toMibPerSecond(double bytesPerSecond) {
        return bytesPerSecond / BYTES_PER_MIB;
    }

    public static double fromMibPerSecond(double mibPerSecond) {
        return mibPerSecond * BYTES_PER_MIB;
    }
}

package com.phillippitts.avifconverter.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Point-in-time memory observation of this process and the host.
 *
 * <p>All sizes are bytes. {@code memoryLimitBytes} is negative when the host exposes no
 * process memory ceiling (no cgroup limit).
 *
 * @param residentBytes       resident set size of the JVM process
 * @param virtualBytes        virtual size of the JVM process
 * @param systemTotalBytes    total physical memory of the host (or container)
 * @param systemAvailableBytes memory the host reports as available
 * @param memoryLimitBytes    process memory ceiling, or -1 if none
 * @param takenAt             sample time
 */
public record MemorySnapshot(
        long residentBytes,
        long virtualBytes,
        long systemTotalBytes,
        long systemAvailableBytes,
        long memoryLimitBytes,
        Instant takenAt
) {
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public MemorySnapshot {
        Objects.requireNonNull(takenAt, "takenAt");
    }

    /** Percentage of system memory in use, 0 when the total is unknown. */
    public double systemPercentUsed() {
        if (systemTotalBytes <= 0) {
            return 0.0;
        }
        double used = (double) (systemTotalBytes - systemAvailableBytes) / systemTotalBytes * 100.0;
        return Math.round(used * 100.0) / 100.0;
    }

    /** Share of system memory held by this process, as a percentage. */
    public double processPercent() {
        if (systemTotalBytes <= 0) {
            return 0.0;
        }
        double pct = (double) residentBytes / systemTotalBytes * 100.0;
        return Math.round(pct * 100.0) / 100.0;
    }

    public OptionalLong memoryLimit() {
        return memoryLimitBytes < 0 ? OptionalLong.empty() : OptionalLong.of(memoryLimitBytes);
    }

    public double residentMb() {
        return toMb(residentBytes);
    }

    public double virtualMb() {
        return toMb(virtualBytes);
    }

    public double systemAvailableMb() {
        return toMb(systemAvailableBytes);
    }

    /**
     * Difference from an earlier snapshot.
     *
     * @param earlier snapshot taken before this one
     * @return resident and available deltas (this minus earlier)
     */
    public Delta since(MemorySnapshot earlier) {
        Objects.requireNonNull(earlier, "earlier");
        return new Delta(residentBytes - earlier.residentBytes,
                systemAvailableBytes - earlier.systemAvailableBytes);
    }

    static double toMb(long bytes) {
        return Math.round(bytes / BYTES_PER_MB * 100.0) / 100.0;
    }

    /**
     * Change between two snapshots, bytes.
     */
    public record Delta(long residentBytes, long systemAvailableBytes) {
        public double residentMb() {
            return toMb(residentBytes);
        }
    }
}

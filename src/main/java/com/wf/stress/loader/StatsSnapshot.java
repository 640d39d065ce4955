package com.wf.stress.loader;

import java.util.List;

/**
 * Point-in-time read of {@link RunStats}. The three counters may be slightly skewed
 * against each other.
 */
public final class StatsSnapshot {

    private final long successBatches;
    private final long failedBatches;
    private final long bytes;
    private final double elapsedSeconds;

    public StatsSnapshot(long successBatches, long failedBatches, long bytes, double elapsedSeconds) {
        this.successBatches = successBatches;
        this.failedBatches = failedBatches;
        this.bytes = bytes;
        this.elapsedSeconds = elapsedSeconds;
    }

    public static StatsSnapshot combine(List<StatsSnapshot> snapshots) {
        long success = 0;
        long failed = 0;
        long bytes = 0;
        double elapsed = 0;
        for (StatsSnapshot s : snapshots) {
            success += s.successBatches;
            failed += s.failedBatches;
            bytes += s.bytes;
            elapsed = Math.max(elapsed, s.elapsedSeconds);
        }
        return new StatsSnapshot(success, failed, bytes, elapsed);
    }

    public long getSuccessBatches() {
        return successBatches;
    }

    public long getFailedBatches() {
        return failedBatches;
    }

    public long getBytes() {
        return bytes;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    @Override
    public String toString() {
        return String.format("StatsSnapshot{success=%d, failed=%d, bytes=%d, elapsed=%.1fs}",
            successBatches, failedBatches, bytes, elapsedSeconds);
    }
}

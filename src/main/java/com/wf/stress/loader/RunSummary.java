package com.wf.stress.loader;

/**
 * Throughput figures derived from a {@link StatsSnapshot}.
 */
public final class RunSummary {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final double elapsedSeconds;
    private final long successBatches;
    private final long successDocuments;
    private final long failedBatches;
    private final long failedDocuments;
    private final double megabytes;
    private final double megabytesPerSecond;

    private RunSummary(double elapsedSeconds, long successBatches, long successDocuments,
                       long failedBatches, long failedDocuments, double megabytes, double megabytesPerSecond) {
        this.elapsedSeconds = elapsedSeconds;
        this.successBatches = successBatches;
        this.successDocuments = successDocuments;
        this.failedBatches = failedBatches;
        this.failedDocuments = failedDocuments;
        this.megabytes = megabytes;
        this.megabytesPerSecond = megabytesPerSecond;
    }

    public static RunSummary derive(StatsSnapshot snapshot, int batchSize) {
        double elapsed = snapshot.getElapsedSeconds();
        double megabytes = snapshot.getBytes() / BYTES_PER_MB;
        double mbps = elapsed > 0 ? megabytes / elapsed : 0.0;

        return new RunSummary(
            elapsed,
            snapshot.getSuccessBatches(),
            snapshot.getSuccessBatches() * batchSize,
            snapshot.getFailedBatches(),
            snapshot.getFailedBatches() * batchSize,
            megabytes,
            mbps);
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public long getSuccessBatches() {
        return successBatches;
    }

    public long getSuccessDocuments() {
        return successDocuments;
    }

    public long getFailedBatches() {
        return failedBatches;
    }

    public long getFailedDocuments() {
        return failedDocuments;
    }

    public double getMegabytes() {
        return megabytes;
    }

    public double getMegabytesPerSecond() {
        return megabytesPerSecond;
    }

    @Override
    public String toString() {
        return String.format(
            "RunSummary{elapsed=%.1fs, successBatches=%d, successDocs=%d, failedBatches=%d, " +
                "failedDocs=%d, mb=%.2f, mbps=%.2f}",
            elapsedSeconds, successBatches, successDocuments, failedBatches,
            failedDocuments, megabytes, megabytesPerSecond);
    }
}

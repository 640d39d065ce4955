package com.wf.stress.loader;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe batch counters for one endpoint.
 *
 * <p>Each counter is independent, so success, failure and byte updates never contend
 * with each other. Updates happen after the write call has returned.
 */
public class RunStats {

    private final AtomicLong successBatches = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();

    public void recordSuccess(long batchBytes) {
        successBatches.incrementAndGet();
        bytesWritten.addAndGet(batchBytes);
    }

    public void recordFailure() {
        failedBatches.incrementAndGet();
    }

    public StatsSnapshot snapshot(double elapsedSeconds) {
        return new StatsSnapshot(successBatches.get(), failedBatches.get(), bytesWritten.get(), elapsedSeconds);
    }

    public long getSuccessBatches() {
        return successBatches.get();
    }

    public long getFailedBatches() {
        return failedBatches.get();
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }
}

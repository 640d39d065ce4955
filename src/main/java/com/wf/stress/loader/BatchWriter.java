package com.wf.stress.loader;

import com.wf.stress.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One load worker. Writes batches until the run is stopped.
 *
 * <p>A failed batch is counted and dropped, never retried. The stop condition is only
 * checked between batches, so an in-flight write always completes first.
 */
public class BatchWriter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

    private final String name;
    private final StoreClient store;
    private final BatchAssembler assembler;
    private final RunStats stats;
    private final RunControl control;

    private long localSuccesses;
    private long localFailures;

    public BatchWriter(String name, StoreClient store, BatchAssembler assembler, RunStats stats, RunControl control) {
        this.name = name;
        this.store = store;
        this.assembler = assembler;
        this.stats = stats;
        this.control = control;
    }

    @Override
    public void run() {
        log.debug("{} started", name);

        while (!control.shouldStop()) {
            writeBatch(assembler.next());
        }

        log.debug("{} stopped after {} successful and {} failed batches", name, localSuccesses, localFailures);
    }

    private void writeBatch(Batch batch) {
        try {
            store.bulkWrite(batch.getEntries());
        } catch (Exception e) {
            stats.recordFailure();
            localFailures++;
            if (localFailures == 1) {
                log.warn("{}: batch write failed: {}", name, e.getMessage());
            } else {
                log.debug("{}: batch write failed: {}", name, e.getMessage());
            }
            return;
        }

        stats.recordSuccess(batch.getSerializedSize());
        localSuccesses++;
    }

    public String getName() {
        return name;
    }

    /**
     * Successful batches seen by this worker. Read only after the worker has finished.
     */
    public long getLocalSuccesses() {
        return localSuccesses;
    }

    public long getLocalFailures() {
        return localFailures;
    }
}

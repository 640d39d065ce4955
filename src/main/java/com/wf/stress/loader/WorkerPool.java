package com.wf.stress.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each {@link BatchWriter} on its own thread.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<BatchWriter> writers;
    private final ExecutorService executor;

    public WorkerPool(List<BatchWriter> writers) {
        if (writers.isEmpty()) {
            throw new IllegalArgumentException("Worker pool needs at least one writer");
        }
        this.writers = List.copyOf(writers);
        this.executor = Executors.newFixedThreadPool(this.writers.size(), new WorkerThreadFactory());
    }

    public void start() {
        log.info("Starting {} workers", writers.size());
        for (BatchWriter writer : writers) {
            executor.submit(writer);
        }
        executor.shutdown();
    }

    /**
     * Wait for every worker to exit, waking every {@code pollInterval} so the caller's
     * thread stays responsive.
     */
    public void awaitCompletion(Duration pollInterval) throws InterruptedException {
        while (!executor.awaitTermination(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("Waiting for workers to finish in-flight batches");
        }
    }

    /**
     * @return true if every worker has exited within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    public List<BatchWriter> getWriters() {
        return writers;
    }

    public int size() {
        return writers.size();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "stress-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

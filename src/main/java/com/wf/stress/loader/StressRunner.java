package com.wf.stress.loader;

import com.wf.stress.config.Endpoint;
import com.wf.stress.config.EndpointParser;
import com.wf.stress.config.StressConfig;
import com.wf.stress.generator.DocumentGenerator;
import com.wf.stress.generator.DocumentPool;
import com.wf.stress.generator.RandomDataProvider;
import com.wf.stress.report.ConsoleReporter;
import com.wf.stress.report.PeriodicStatsReporter;
import com.wf.stress.store.HealthTimeoutException;
import com.wf.stress.store.ShardConfig;
import com.wf.stress.store.StoreClient;
import com.wf.stress.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives a stress run across all endpoints.
 *
 * <p>Endpoints are prepared one after another (connect, create containers, wait for
 * health). Workers for every healthy endpoint then start together under one deadline.
 * Once they have all exited, containers are deleted (unless disabled) and the final
 * summary is printed.
 *
 * <p>{@link #requestShutdown()} may be called from any thread, typically a JVM
 * shutdown hook. It stops workers after their in-flight batch; cleanup and the final
 * summary still happen.
 */
public class StressRunner {

    private static final Logger log = LoggerFactory.getLogger(StressRunner.class);

    private static final Duration JOIN_POLL_INTERVAL = Duration.ofMillis(500);

    private final StressConfig config;
    private final StoreClientFactory clientFactory;
    private final ConsoleReporter reporter;
    private final Clock clock;
    private final RandomDataProvider random = new RandomDataProvider();

    private final ShutdownSignal signal = new ShutdownSignal();
    private final AtomicBoolean interruptRequested = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final List<TargetRun> targets = new CopyOnWriteArrayList<>();
    private final List<RunState> stateHistory = Collections.synchronizedList(new ArrayList<>());
    private final Object healthWaitLock = new Object();

    private volatile RunState state;
    private volatile Thread runnerThread;
    private boolean inHealthWait;
    private volatile List<BatchWriter> writers = Collections.emptyList();
    private double finalElapsedSeconds;

    public StressRunner(StressConfig config, StoreClientFactory clientFactory, ConsoleReporter reporter) {
        this(config, clientFactory, reporter, Clock.systemUTC());
    }

    public StressRunner(StressConfig config, StoreClientFactory clientFactory, ConsoleReporter reporter, Clock clock) {
        this.config = config;
        this.clientFactory = clientFactory;
        this.reporter = reporter;
        this.clock = clock;
        transition(RunState.INITIALIZING);
    }

    /**
     * Execute the run.
     *
     * @throws com.wf.stress.config.ConfigException if the configuration is invalid;
     *         nothing has been created in that case
     */
    public RunResult run() {
        runnerThread = Thread.currentThread();
        try {
            return execute();
        } finally {
            closeClients();
            finished.countDown();
        }
    }

    private RunResult execute() {
        config.validate();
        List<Endpoint> endpoints = new EndpointParser().parseAll(config.getEndpoints());

        log.info("Generating {} documents ({} variants)", config.getDocuments(), config.getVariants());
        DocumentPool pool = new DocumentGenerator(random).buildPool(
            config.getDocuments(), config.getVariants(),
            config.getMaxFieldsPerDocument(), config.getMaxSizePerField());

        reporter.printRunHeader(config, endpoints);

        try {
            for (Endpoint endpoint : endpoints) {
                if (signal.isSet()) {
                    log.info("Shutdown requested; skipping remaining endpoints");
                    break;
                }
                prepare(endpoint);
            }

            List<TargetRun> healthy = targets.stream()
                .filter(TargetRun::isHealthy)
                .collect(Collectors.toList());

            if (healthy.isEmpty()) {
                log.warn("No endpoint is ready; no load will be generated");
            } else if (!signal.isSet()) {
                runLoad(healthy, pool);
            }
        } finally {
            transition(RunState.CLEANUP);
            // Deletes fail on an interrupted thread; restore the flag once they are done
            boolean interrupted = Thread.interrupted();
            if (config.isNoCleanup()) {
                log.info("Cleanup disabled; leaving containers in place");
            } else {
                cleanup();
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        transition(RunState.DONE);
        RunResult result = buildResult();
        reporter.printFinalResults(result);
        return result;
    }

    private void prepare(Endpoint endpoint) {
        transition(RunState.PROVISIONING);
        log.info("Starting initialization of {}", endpoint);

        StoreClient store = clientFactory.connect(endpoint);
        TargetRun target = new TargetRun(
            endpoint, store, new ContainerProvisioner(store, random, config.getCollectionPrefix()));
        targets.add(target);

        target.provision(config.getContainers(), new ShardConfig(config.getNumberOfShards()));
        reporter.printEndpointReady(endpoint, target.getContainers().size());

        if (config.isWaitForHealthy()) {
            transition(RunState.AWAITING_HEALTH);
            beginHealthWait();
            try {
                target.awaitHealthy(config.getHealthTimeoutSeconds());
            } catch (HealthTimeoutException e) {
                endHealthWait();
                if (signal.isSet()) {
                    target.markHealthWaitInterrupted();
                }
                log.warn("Endpoint {} did not become healthy: {}", endpoint, e.getMessage());
                reporter.printHealthTimeout(endpoint, e.getMessage());
                List<StoreException> errors = target.cleanup();
                reporter.printCleanup(target.getContainers().size(), errors.size());
                return;
            }
            endHealthWait();
        }

        target.markHealthy();
    }

    private void runLoad(List<TargetRun> healthy, DocumentPool pool) {
        transition(RunState.RUNNING);

        Deadline deadline = Deadline.start(clock, Duration.ofSeconds(config.getSeconds()));
        RunControl control = new RunControl(signal, deadline);

        List<BatchWriter> allWriters = new ArrayList<>();
        for (TargetRun target : healthy) {
            BatchAssembler assembler = new BatchAssembler(
                target.getContainers(), pool, config.getBatchSize(), random);
            for (int i = 1; i <= config.getWorkers(); i++) {
                allWriters.add(new BatchWriter(
                    target.getEndpoint() + "#" + i, target.getStore(), assembler, target.getStats(), control));
            }
        }
        writers = List.copyOf(allWriters);

        WorkerPool workerPool = new WorkerPool(allWriters);
        reporter.printRunStart(config, workerPool.size());
        workerPool.start();

        PeriodicStatsReporter statsReporter = new PeriodicStatsReporter(
            control, Duration.ofSeconds(config.getStatsFrequency()),
            () -> RunSummary.derive(combinedSnapshot(healthy, deadline.elapsedSeconds()), config.getBatchSize()),
            reporter::printProgress);
        Thread statsThread = new Thread(statsReporter, "stress-stats");
        statsThread.setDaemon(true);
        statsThread.start();

        try {
            while (!workerPool.awaitTermination(JOIN_POLL_INTERVAL) && !signal.isSet()) {
                log.trace("Workers still running");
            }
        } catch (InterruptedException e) {
            // Converted into a shutdown request; the drain below still waits for workers
            requestShutdown();
        }

        drain(workerPool);
        finalElapsedSeconds = deadline.elapsedSeconds();

        try {
            statsThread.join(JOIN_POLL_INTERVAL.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void drain(WorkerPool workerPool) {
        transition(RunState.DRAINING);
        signal.set();
        try {
            workerPool.awaitCompletion(JOIN_POLL_INTERVAL);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers; continuing with cleanup");
        }
        log.info("All workers stopped");
    }

    private void cleanup() {
        for (TargetRun target : targets) {
            if (target.isCleanedUp()) {
                continue;
            }
            List<StoreException> errors = target.cleanup();
            reporter.printCleanup(target.getContainers().size(), errors.size());
        }
    }

    /**
     * Delete every container created so far. Safe to call more than once.
     */
    public void cleanupAll() {
        cleanup();
    }

    private StatsSnapshot combinedSnapshot(List<TargetRun> runs, double elapsedSeconds) {
        return StatsSnapshot.combine(runs.stream()
            .map(t -> t.getStats().snapshot(elapsedSeconds))
            .collect(Collectors.toList()));
    }

    private RunResult buildResult() {
        List<TargetResult> results = new ArrayList<>();
        List<StatsSnapshot> snapshots = new ArrayList<>();

        for (TargetRun target : targets) {
            StatsSnapshot snapshot = target.getStats().snapshot(target.isHealthy() ? finalElapsedSeconds : 0);
            results.add(new TargetResult(
                target.getEndpoint().toSeedList(),
                target.isHealthy(),
                target.isHealthWaitInterrupted(),
                target.getContainers().size(),
                target.getCleanupErrors(),
                RunSummary.derive(snapshot, config.getBatchSize())));
            if (target.isHealthy()) {
                snapshots.add(snapshot);
            }
        }

        RunSummary total = RunSummary.derive(StatsSnapshot.combine(snapshots), config.getBatchSize());
        return new RunResult(results, total, interruptRequested.get());
    }

    /**
     * Ask the run to stop. Idempotent; returns immediately.
     */
    public void requestShutdown() {
        if (finished.getCount() == 0) {
            return;
        }
        if (interruptRequested.compareAndSet(false, true)) {
            log.info("Shutdown requested");
            reporter.printInterrupted();
        }
        signal.set();

        // Only the health wait is safe to interrupt; it is a sleep between pings
        synchronized (healthWaitLock) {
            Thread thread = runnerThread;
            if (thread != null && inHealthWait) {
                thread.interrupt();
            }
        }
    }

    private void beginHealthWait() {
        synchronized (healthWaitLock) {
            inHealthWait = true;
        }
    }

    /**
     * Close the window in which {@link #requestShutdown()} may interrupt the runner,
     * then drop any interrupt it delivered.
     */
    private void endHealthWait() {
        synchronized (healthWaitLock) {
            inHealthWait = false;
            Thread.interrupted();
        }
    }

    /**
     * Wait for {@link #run()} to return.
     *
     * @return true if the run has finished
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void closeClients() {
        for (TargetRun target : targets) {
            try {
                target.getStore().close();
            } catch (RuntimeException e) {
                log.warn("Error closing client for {}: {}", target.getEndpoint(), e.getMessage());
            }
        }
    }

    private void transition(RunState next) {
        log.debug("Run state {} -> {}", state, next);
        state = next;
        stateHistory.add(next);
    }

    public RunState getState() {
        return state;
    }

    public List<RunState> getStateHistory() {
        synchronized (stateHistory) {
            return List.copyOf(stateHistory);
        }
    }

    /**
     * Workers of the last run; each has finished once {@link #run()} returns.
     */
    public List<BatchWriter> getWriters() {
        return writers;
    }

    public ShutdownSignal getSignal() {
        return signal;
    }
}

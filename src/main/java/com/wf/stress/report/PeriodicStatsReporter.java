package com.wf.stress.report;

import com.wf.stress.loader.RunControl;
import com.wf.stress.loader.RunSummary;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Prints a throughput summary every interval until the run stops.
 *
 * <p>A wake-up after the deadline prints nothing; the final summary covers that moment.
 */
public class PeriodicStatsReporter implements Runnable {

    private final RunControl control;
    private final long intervalMillis;
    private final Supplier<RunSummary> summarySupplier;
    private final Consumer<RunSummary> sink;

    public PeriodicStatsReporter(RunControl control, Duration interval,
                                 Supplier<RunSummary> summarySupplier, Consumer<RunSummary> sink) {
        this.control = control;
        this.intervalMillis = interval.toMillis();
        this.summarySupplier = summarySupplier;
        this.sink = sink;
    }

    @Override
    public void run() {
        while (!control.shouldStop()) {
            try {
                if (control.getSignal().await(intervalMillis, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (!control.getDeadline().hasPassed()) {
                sink.accept(summarySupplier.get());
            }
        }
    }
}

package com.wf.stress.loader;

/**
 * Stop condition checked at the top of every worker and reporter iteration.
 */
public final class RunControl {

    private final ShutdownSignal signal;
    private final Deadline deadline;

    public RunControl(ShutdownSignal signal, Deadline deadline) {
        this.signal = signal;
        this.deadline = deadline;
    }

    public boolean shouldStop() {
        return signal.isSet() || deadline.hasPassed();
    }

    public ShutdownSignal getSignal() {
        return signal;
    }

    public Deadline getDeadline() {
        return deadline;
    }
}

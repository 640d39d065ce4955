package com.wf.stress.loader;

import java.util.List;

public final class RunResult {

    private final List<TargetResult> targets;
    private final RunSummary total;
    private final boolean interrupted;

    public RunResult(List<TargetResult> targets, RunSummary total, boolean interrupted) {
        this.targets = List.copyOf(targets);
        this.total = total;
        this.interrupted = interrupted;
    }

    public List<TargetResult> getTargets() {
        return targets;
    }

    public RunSummary getTotal() {
        return total;
    }

    public boolean isInterrupted() {
        return interrupted;
    }
}

package com.wf.stress.loader;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Write-once stop flag shared by workers, the stats reporter and the orchestrator.
 * Once set it stays set.
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void set() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Wait up to {@code timeout} for the signal.
     *
     * @return true if the signal is set
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }
}

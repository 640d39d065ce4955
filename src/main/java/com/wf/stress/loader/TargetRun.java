package com.wf.stress.loader;

import com.wf.stress.config.Endpoint;
import com.wf.stress.store.ShardConfig;
import com.wf.stress.store.StoreClient;
import com.wf.stress.store.StoreException;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-endpoint state of a run: its client, its containers and its counters.
 */
class TargetRun {

    private final Endpoint endpoint;
    private final StoreClient store;
    private final ContainerProvisioner provisioner;
    private final RunStats stats;
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    private volatile List<String> containers = Collections.emptyList();
    private volatile boolean healthy;
    private volatile boolean healthWaitInterrupted;
    private volatile int cleanupErrors;

    TargetRun(Endpoint endpoint, StoreClient store, ContainerProvisioner provisioner) {
        this.endpoint = endpoint;
        this.store = store;
        this.provisioner = provisioner;
        this.stats = new RunStats();
    }

    void provision(int count, ShardConfig shardConfig) {
        containers = List.copyOf(provisioner.createContainers(count, shardConfig));
    }

    void awaitHealthy(int timeoutSeconds) {
        provisioner.waitUntilHealthy(timeoutSeconds);
    }

    /**
     * Delete this endpoint's containers. Only the first call deletes anything.
     */
    List<StoreException> cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return Collections.emptyList();
        }
        List<StoreException> errors = provisioner.deleteContainers(containers);
        cleanupErrors = errors.size();
        return errors;
    }

    Endpoint getEndpoint() {
        return endpoint;
    }

    StoreClient getStore() {
        return store;
    }

    RunStats getStats() {
        return stats;
    }

    List<String> getContainers() {
        return containers;
    }

    boolean isHealthy() {
        return healthy;
    }

    void markHealthy() {
        this.healthy = true;
    }

    boolean isHealthWaitInterrupted() {
        return healthWaitInterrupted;
    }

    void markHealthWaitInterrupted() {
        this.healthWaitInterrupted = true;
    }

    boolean isCleanedUp() {
        return cleanedUp.get();
    }

    int getCleanupErrors() {
        return cleanupErrors;
    }
}

package com.wf.stress.store;

import java.util.List;

/**
 * The operations the load harness needs from a target store.
 *
 * <p>Implementations must tolerate concurrent {@link #bulkWrite} calls from many
 * worker threads.
 */
public interface StoreClient extends AutoCloseable {

    /**
     * Create a named container.
     *
     * @throws StoreException if the store rejects the create
     */
    void createContainer(String name, ShardConfig shardConfig);

    /**
     * Delete a named container. Deleting a container that does not exist is not an error.
     *
     * @throws StoreException if the store rejects the delete
     */
    void deleteContainer(String name);

    /**
     * Block until the store reports healthy.
     *
     * @throws HealthTimeoutException if it is not healthy within {@code timeoutSeconds}
     */
    void waitHealthy(int timeoutSeconds);

    /**
     * Write a batch. The batch succeeds or fails as a whole from the caller's view.
     *
     * @throws StoreException if any part of the batch fails
     */
    void bulkWrite(List<BatchEntry> entries);

    /**
     * Names of existing containers that start with {@code prefix}.
     */
    List<String> listContainers(String prefix);

    @Override
    void close();
}

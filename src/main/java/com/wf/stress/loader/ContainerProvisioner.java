package com.wf.stress.loader;

import com.wf.stress.generator.RandomDataProvider;
import com.wf.stress.store.ShardConfig;
import com.wf.stress.store.StoreClient;
import com.wf.stress.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates and removes the randomly named containers a run writes into.
 *
 * <p>Create and delete are best-effort: a failure on one name is logged and the
 * remaining names are still processed.
 */
public class ContainerProvisioner {

    private static final Logger log = LoggerFactory.getLogger(ContainerProvisioner.class);

    static final int NAME_LENGTH = 16;

    private final StoreClient store;
    private final RandomDataProvider random;
    private final String prefix;

    public ContainerProvisioner(StoreClient store, RandomDataProvider random, String prefix) {
        this.store = store;
        this.random = random;
        this.prefix = prefix != null ? prefix : "";
    }

    /**
     * Create {@code count} containers. Names whose create failed are still returned so
     * that cleanup can try them.
     */
    public List<String> createContainers(int count, ShardConfig shardConfig) {
        List<String> names = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            String name = prefix + random.randomLowercaseOfLength(NAME_LENGTH);
            names.add(name);

            try {
                store.createContainer(name, shardConfig);
                log.debug("Created container {}", name);
            } catch (StoreException e) {
                log.warn("Could not create container {}. Is the store ok? {}", name, e.getMessage());
            }
        }

        return names;
    }

    /**
     * @throws com.wf.stress.store.HealthTimeoutException if the store stays unhealthy
     */
    public void waitUntilHealthy(int timeoutSeconds) {
        log.info("Waiting up to {}s for the store to become healthy", timeoutSeconds);
        store.waitHealthy(timeoutSeconds);
    }

    /**
     * Delete every named container.
     *
     * @return the errors encountered, empty if every delete succeeded
     */
    public List<StoreException> deleteContainers(List<String> names) {
        List<StoreException> errors = new ArrayList<>();

        for (String name : names) {
            try {
                store.deleteContainer(name);
                log.debug("Deleted container {}", name);
            } catch (StoreException e) {
                errors.add(e);
                log.warn("Could not delete container {}. Continuing: {}", name, e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            log.warn("{} of {} containers could not be deleted", errors.size(), names.size());
        }
        return errors;
    }
}

package com.wf.stress.store;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.InsertManyOptions;
import com.wf.stress.config.ConnectionConfig;
import com.wf.stress.config.Endpoint;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link StoreClient} backed by the MongoDB sync driver. Containers are collections
 * in a single database.
 */
public class MongoStoreClient implements StoreClient {

    private static final Logger log = LoggerFactory.getLogger(MongoStoreClient.class);

    private static final long HEALTH_POLL_INTERVAL_MS = 1000;

    private final MongoClient client;
    private final MongoDatabase database;
    private final InsertManyOptions insertOptions = new InsertManyOptions().ordered(false);

    public MongoStoreClient(MongoClient client, String databaseName) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
    }

    public static MongoStoreClient connect(ConnectionConfig config, Endpoint endpoint) {
        return new MongoStoreClient(config.createClient(endpoint), config.getDatabase());
    }

    @Override
    public void createContainer(String name, ShardConfig shardConfig) {
        try {
            database.createCollection(name);
        } catch (MongoException e) {
            throw new StoreException("Could not create collection " + name + ": " + e.getMessage(), e);
        }

        if (shardConfig.isSharded()) {
            shardCollection(name, shardConfig);
        }
    }

    private void shardCollection(String name, ShardConfig shardConfig) {
        String namespace = database.getName() + "." + name;
        MongoDatabase admin = client.getDatabase("admin");
        try {
            admin.runCommand(new Document("enableSharding", database.getName()));
            admin.runCommand(new Document("shardCollection", namespace)
                .append("key", new Document("_id", "hashed"))
                .append("numInitialChunks", shardConfig.getNumberOfShards()));
            log.debug("Sharded {} into {} initial chunks", namespace, shardConfig.getNumberOfShards());
        } catch (MongoException e) {
            // Standalone and replica-set deployments reject sharding commands
            log.warn("Could not shard {} (continuing unsharded): {}", namespace, e.getMessage());
        }
    }

    @Override
    public void deleteContainer(String name) {
        try {
            database.getCollection(name).drop();
        } catch (MongoException e) {
            throw new StoreException("Could not drop collection " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void waitHealthy(int timeoutSeconds) {
        long deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        MongoDatabase admin = client.getDatabase("admin");
        MongoException lastError = null;

        while (System.nanoTime() < deadlineNanos) {
            try {
                Document hello = admin.runCommand(new Document("hello", 1));
                if (isWritablePrimary(hello)) {
                    return;
                }
                log.debug("Waiting for a writable primary: {}", hello.toJson());
            } catch (MongoException e) {
                lastError = e;
                log.debug("Health check failed: {}", e.getMessage());
            }

            try {
                Thread.sleep(HEALTH_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HealthTimeoutException("Interrupted while waiting for store health", e);
            }
        }

        String reason = lastError != null ? lastError.getMessage() : "no writable primary";
        throw new HealthTimeoutException(
            String.format("Store not healthy after %d seconds (%s)", timeoutSeconds, reason), lastError);
    }

    static boolean isWritablePrimary(Document hello) {
        if (hello.containsKey("isWritablePrimary")) {
            return hello.getBoolean("isWritablePrimary", false);
        }
        return hello.getBoolean("ismaster", false);
    }

    @Override
    public void bulkWrite(List<BatchEntry> entries) {
        Map<String, List<Document>> byCollection = new LinkedHashMap<>();
        for (BatchEntry entry : entries) {
            byCollection.computeIfAbsent(entry.getContainer(), k -> new ArrayList<>())
                .add(entry.getDocument().toBson());
        }

        try {
            for (Map.Entry<String, List<Document>> group : byCollection.entrySet()) {
                database.getCollection(group.getKey()).insertMany(group.getValue(), insertOptions);
            }
        } catch (MongoException e) {
            throw new StoreException("Bulk write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listContainers(String prefix) {
        List<String> names = new ArrayList<>();
        try {
            for (String name : database.listCollectionNames()) {
                if (name.startsWith(prefix)) {
                    names.add(name);
                }
            }
        } catch (MongoException e) {
            throw new StoreException("Could not list collections: " + e.getMessage(), e);
        }
        return names;
    }

    @Override
    public void close() {
        client.close();
    }
}

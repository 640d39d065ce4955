package com.wf.stress.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class StressConfig {

    // Connection settings
    private ConnectionConfig connection = new ConnectionConfig();
    private List<String> endpoints = new ArrayList<>();

    // Provisioning
    private int containers = 5;
    private String collectionPrefix = "stress_";
    private int numberOfShards = 3;
    private boolean waitForHealthy = true;
    private int healthTimeoutSeconds = 600;
    private boolean noCleanup = false;

    // Document synthesis
    private int documents = 100;
    private int variants = 10;
    private int maxFieldsPerDocument = 100;
    private int maxSizePerField = 1000;

    // Load shape
    private int workers = 4;
    private int seconds = 60;
    private int batchSize = 1000;

    // Reporting
    private int statsFrequency = 30;
    private boolean quiet = false;

    public StressConfig() {
    }

    public static StressConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Object data = yaml.load(input);
            if (data != null && !(data instanceof Map)) {
                throw new ConfigException("Config file " + filePath + " must contain a mapping at the top level");
            }
            return fromMap(asMap("top level", data));
        } catch (YAMLException e) {
            throw new ConfigException("Config file " + filePath + " is not valid YAML: " + e.getMessage(), e);
        }
    }

    static StressConfig fromMap(Map<String, Object> data) {
        StressConfig config = new StressConfig();
        if (data == null) {
            return config;
        }

        if (data.containsKey("connection")) {
            Map<String, Object> conn = section(data, "connection");
            if (conn.containsKey("endpoints")) {
                config.endpoints = stringList(conn, "endpoints", "connection.");
            }
            if (conn.containsKey("database")) {
                config.connection.setDatabase(string(conn, "database", "connection."));
            }
            if (conn.containsKey("username")) {
                config.connection.setUsername(string(conn, "username", "connection."));
            }
            if (conn.containsKey("password")) {
                config.connection.setPassword(String.valueOf(conn.get("password")));
            }
            if (conn.containsKey("authDatabase")) {
                config.connection.setAuthDatabase(string(conn, "authDatabase", "connection."));
            }
            if (conn.containsKey("tls")) {
                config.connection.setTls(bool(conn, "tls", "connection."));
            }
            if (conn.containsKey("writeConcern")) {
                config.connection.setWriteConcern(string(conn, "writeConcern", "connection."));
            }
            if (conn.containsKey("connectionPoolSize")) {
                config.connection.setConnectionPoolSize(integer(conn, "connectionPoolSize", "connection."));
            }
        }

        if (data.containsKey("stress")) {
            Map<String, Object> stress = section(data, "stress");

            if (stress.containsKey("containers")) {
                config.containers = integer(stress, "containers", "stress.");
            }
            if (stress.containsKey("collectionPrefix")) {
                config.collectionPrefix = string(stress, "collectionPrefix", "stress.");
            }
            if (stress.containsKey("numberOfShards")) {
                config.numberOfShards = integer(stress, "numberOfShards", "stress.");
            }
            if (stress.containsKey("waitForHealthy")) {
                config.waitForHealthy = bool(stress, "waitForHealthy", "stress.");
            }
            if (stress.containsKey("healthTimeoutSeconds")) {
                config.healthTimeoutSeconds = integer(stress, "healthTimeoutSeconds", "stress.");
            }
            if (stress.containsKey("noCleanup")) {
                config.noCleanup = bool(stress, "noCleanup", "stress.");
            }
            if (stress.containsKey("workers")) {
                config.workers = integer(stress, "workers", "stress.");
            }
            if (stress.containsKey("seconds")) {
                config.seconds = integer(stress, "seconds", "stress.");
            }
            if (stress.containsKey("batchSize")) {
                config.batchSize = integer(stress, "batchSize", "stress.");
            }
            if (stress.containsKey("statsFrequency")) {
                config.statsFrequency = integer(stress, "statsFrequency", "stress.");
            }
            if (stress.containsKey("quiet")) {
                config.quiet = bool(stress, "quiet", "stress.");
            }

            if (stress.containsKey("documents")) {
                Map<String, Object> docs = asMap("stress.documents", stress.get("documents"));
                if (docs.containsKey("count")) {
                    config.documents = integer(docs, "count", "stress.documents.");
                }
                if (docs.containsKey("variants")) {
                    config.variants = integer(docs, "variants", "stress.documents.");
                }
                if (docs.containsKey("maxFields")) {
                    config.maxFieldsPerDocument = integer(docs, "maxFields", "stress.documents.");
                }
                if (docs.containsKey("maxFieldSize")) {
                    config.maxSizePerField = integer(docs, "maxFieldSize", "stress.documents.");
                }
            }
        }

        return config;
    }

    private static Map<String, Object> section(Map<String, Object> data, String key) {
        return asMap(key, data.get(key));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String key, Object value) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw mistyped(key, "a mapping", value);
        }
        return (Map<String, Object>) value;
    }

    private static int integer(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof Integer)) {
            throw mistyped(path + key, "an integer", value);
        }
        return (Integer) value;
    }

    private static boolean bool(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof Boolean)) {
            throw mistyped(path + key, "true or false", value);
        }
        return (Boolean) value;
    }

    private static String string(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof String)) {
            throw mistyped(path + key, "a string", value);
        }
        return (String) value;
    }

    // A single scalar is accepted as a one-element list
    private static List<String> stringList(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (value instanceof String) {
            return new ArrayList<>(List.of((String) value));
        }
        if (!(value instanceof List)) {
            throw mistyped(path + key, "a list of strings", value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw mistyped(path + key, "a list of strings", value);
            }
            result.add((String) item);
        }
        return result;
    }

    private static ConfigException mistyped(String key, String expected, Object value) {
        return new ConfigException(String.format("'%s' must be %s (was %s)", key, expected, value));
    }

    /**
     * Checks every bound the run depends on.
     *
     * @throws ConfigException naming the first invalid setting
     */
    public void validate() {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new ConfigException("At least one endpoint is required");
        }
        new EndpointParser().parseAll(endpoints);
        requireAtLeast("containers", containers, 1);
        requireAtLeast("documents", documents, 1);
        requireAtLeast("variants", variants, 0);
        requireAtLeast("max-fields-per-document", maxFieldsPerDocument, 1);
        requireAtLeast("max-size-per-field", maxSizePerField, 1);
        requireAtLeast("workers", workers, 1);
        requireAtLeast("seconds", seconds, 1);
        requireAtLeast("batch-size", batchSize, 1);
        requireAtLeast("number-of-shards", numberOfShards, 1);
        requireAtLeast("stats-frequency", statsFrequency, 1);
        requireAtLeast("health-timeout", healthTimeoutSeconds, 1);
        connection.resolveWriteConcern();
    }

    private static void requireAtLeast(String name, int value, int minimum) {
        if (value < minimum) {
            throw new ConfigException(String.format("%s must be >= %d (was %d)", name, minimum, value));
        }
    }

    // Getters and setters
    public ConnectionConfig getConnection() {
        return connection;
    }

    public void setConnection(ConnectionConfig connection) {
        this.connection = connection;
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<String> endpoints) {
        this.endpoints = endpoints;
    }

    public int getContainers() {
        return containers;
    }

    public void setContainers(int containers) {
        this.containers = containers;
    }

    public String getCollectionPrefix() {
        return collectionPrefix;
    }

    public void setCollectionPrefix(String collectionPrefix) {
        this.collectionPrefix = collectionPrefix;
    }

    public int getNumberOfShards() {
        return numberOfShards;
    }

    public void setNumberOfShards(int numberOfShards) {
        this.numberOfShards = numberOfShards;
    }

    public boolean isWaitForHealthy() {
        return waitForHealthy;
    }

    public void setWaitForHealthy(boolean waitForHealthy) {
        this.waitForHealthy = waitForHealthy;
    }

    public int getHealthTimeoutSeconds() {
        return healthTimeoutSeconds;
    }

    public void setHealthTimeoutSeconds(int healthTimeoutSeconds) {
        this.healthTimeoutSeconds = healthTimeoutSeconds;
    }

    public boolean isNoCleanup() {
        return noCleanup;
    }

    public void setNoCleanup(boolean noCleanup) {
        this.noCleanup = noCleanup;
    }

    public int getDocuments() {
        return documents;
    }

    public void setDocuments(int documents) {
        this.documents = documents;
    }

    public int getVariants() {
        return variants;
    }

    public void setVariants(int variants) {
        this.variants = variants;
    }

    public int getMaxFieldsPerDocument() {
        return maxFieldsPerDocument;
    }

    public void setMaxFieldsPerDocument(int maxFieldsPerDocument) {
        this.maxFieldsPerDocument = maxFieldsPerDocument;
    }

    public int getMaxSizePerField() {
        return maxSizePerField;
    }

    public void setMaxSizePerField(int maxSizePerField) {
        this.maxSizePerField = maxSizePerField;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getSeconds() {
        return seconds;
    }

    public void setSeconds(int seconds) {
        this.seconds = seconds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getStatsFrequency() {
        return statsFrequency;
    }

    public void setStatsFrequency(int statsFrequency) {
        this.statsFrequency = statsFrequency;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }
}

package com.wf.stress.command;

import com.wf.stress.config.ConfigException;
import com.wf.stress.config.EndpointParser;
import com.wf.stress.config.StressConfig;
import com.wf.stress.loader.RunResult;
import com.wf.stress.loader.StoreClientFactory;
import com.wf.stress.loader.StressRunner;
import com.wf.stress.report.ConsoleReporter;
import com.wf.stress.store.MongoStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Write synthetic documents into freshly created collections for a fixed time",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    private static final Duration SHUTDOWN_WAIT_SLICE = Duration.ofSeconds(1);
    private static final int SHUTDOWN_WAIT_MAX_SLICES = 180;

    @Option(names = {"-e", "--endpoint"},
        description = "Target address host[:port][,host[:port]...]; repeat for several endpoints")
    private List<String> endpoints;

    @Option(names = {"-n", "--containers"}, description = "Collections to create per endpoint")
    private Integer containers;

    @Option(names = {"--documents"}, description = "Distinct base documents to generate")
    private Integer documents;

    @Option(names = {"--variants"}, description = "Extra documents derived from base documents")
    private Integer variants;

    @Option(names = {"-w", "--workers"}, description = "Writer threads per endpoint")
    private Integer workers;

    @Option(names = {"-s", "--seconds"}, description = "Run duration in seconds")
    private Integer seconds;

    @Option(names = {"-b", "--batch-size"}, description = "Documents per bulk write")
    private Integer batchSize;

    @Option(names = {"--max-fields-per-document"}, description = "Max number of fields in each document")
    private Integer maxFieldsPerDocument;

    @Option(names = {"--max-size-per-field"}, description = "Max content size per field")
    private Integer maxSizePerField;

    @Option(names = {"--number-of-shards"}, description = "Initial chunks when sharding each collection")
    private Integer numberOfShards;

    @Option(names = {"--no-wait-healthy"}, description = "Start without waiting for a writable primary")
    private boolean noWaitHealthy;

    @Option(names = {"--health-timeout"}, description = "Seconds to wait for the store to become healthy")
    private Integer healthTimeout;

    @Option(names = {"--no-cleanup"}, description = "Don't drop the collections when finished")
    private boolean noCleanup;

    @Option(names = {"--stats-frequency"}, description = "Seconds between progress prints")
    private Integer statsFrequency;

    @Option(names = {"-d", "--database"}, description = "Target database name")
    private String database;

    @Option(names = {"-P", "--collection-prefix"}, description = "Prefix for generated collection names")
    private String collectionPrefix;

    @Option(names = {"-u", "--username"}, description = "User name, if the store requires authentication")
    private String username;

    @Option(names = {"-p", "--password"}, description = "Password for --username", interactive = true, arity = "0..1")
    private String password;

    @Option(names = {"--tls"}, description = "Connect using TLS")
    private boolean tls;

    @Option(names = {"--write-concern"}, description = "acknowledged, unacknowledged or majority")
    private String writeConcern;

    @Option(names = {"--connection-pool"}, description = "Driver connection pool size per endpoint")
    private Integer connectionPoolSize;

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    private String configFile;

    @Option(names = {"--dry-run"}, description = "Show the run plan without connecting", defaultValue = "false")
    private boolean dryRun;

    @Option(names = {"-q", "--quiet"}, description = "Print only the final summary", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        StressConfig config;
        try {
            config = buildConfig();
            config.validate();
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        } catch (IOException e) {
            System.err.println("Could not read config file: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        }

        ConsoleReporter reporter = new ConsoleReporter(config.isQuiet());

        try {
            if (dryRun) {
                reporter.printDryRun(config, new EndpointParser().parseAll(config.getEndpoints()));
                return ExitCodes.OK;
            }
            return executeRun(config, reporter);
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        } catch (Exception e) {
            System.err.println("Got unexpected exception. Probably a bug, please report it.");
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return ExitCodes.FAILURE;
        }
    }

    StressConfig buildConfig() throws IOException {
        StressConfig config = configFile != null ? StressConfig.fromYaml(configFile) : new StressConfig();

        // CLI options override config file
        if (endpoints != null && !endpoints.isEmpty()) {
            config.setEndpoints(endpoints);
        }
        if (containers != null) {
            config.setContainers(containers);
        }
        if (documents != null) {
            config.setDocuments(documents);
        }
        if (variants != null) {
            config.setVariants(variants);
        }
        if (workers != null) {
            config.setWorkers(workers);
        }
        if (seconds != null) {
            config.setSeconds(seconds);
        }
        if (batchSize != null) {
            config.setBatchSize(batchSize);
        }
        if (maxFieldsPerDocument != null) {
            config.setMaxFieldsPerDocument(maxFieldsPerDocument);
        }
        if (maxSizePerField != null) {
            config.setMaxSizePerField(maxSizePerField);
        }
        if (numberOfShards != null) {
            config.setNumberOfShards(numberOfShards);
        }
        if (noWaitHealthy) {
            config.setWaitForHealthy(false);
        }
        if (healthTimeout != null) {
            config.setHealthTimeoutSeconds(healthTimeout);
        }
        if (noCleanup) {
            config.setNoCleanup(true);
        }
        if (statsFrequency != null) {
            config.setStatsFrequency(statsFrequency);
        }
        if (collectionPrefix != null) {
            config.setCollectionPrefix(collectionPrefix);
        }
        if (quiet) {
            config.setQuiet(true);
        }

        if (database != null) {
            config.getConnection().setDatabase(database);
        }
        if (username != null) {
            config.getConnection().setUsername(username);
        }
        if (password != null) {
            config.getConnection().setPassword(password);
        }
        if (tls) {
            config.getConnection().setTls(true);
        }
        if (writeConcern != null) {
            config.getConnection().setWriteConcern(writeConcern);
        }
        if (connectionPoolSize != null) {
            config.getConnection().setConnectionPoolSize(connectionPoolSize);
        }

        return config;
    }

    private int executeRun(StressConfig config, ConsoleReporter reporter) {
        StoreClientFactory factory = endpoint -> MongoStoreClient.connect(config.getConnection(), endpoint);
        StressRunner runner = new StressRunner(config, factory, reporter);

        Thread hook = new Thread(() -> awaitGracefulShutdown(runner), "stress-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        RunResult result;
        try {
            result = runner.run();
        } finally {
            removeHook(hook);
        }

        return result.isInterrupted() ? ExitCodes.INTERRUPTED : ExitCodes.OK;
    }

    private static void awaitGracefulShutdown(StressRunner runner) {
        runner.requestShutdown();
        try {
            for (int i = 0; i < SHUTDOWN_WAIT_MAX_SLICES; i++) {
                if (runner.awaitFinished(SHUTDOWN_WAIT_SLICE)) {
                    return;
                }
            }
            log.warn("Run did not finish draining in time; exiting anyway");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is waiting on this run
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}

package com.wf.stress.command;

import com.wf.stress.config.ConfigException;
import com.wf.stress.config.ConnectionConfig;
import com.wf.stress.config.Endpoint;
import com.wf.stress.config.EndpointParser;
import com.wf.stress.generator.RandomDataProvider;
import com.wf.stress.loader.ContainerProvisioner;
import com.wf.stress.loader.StoreClientFactory;
import com.wf.stress.store.MongoStoreClient;
import com.wf.stress.store.StoreClient;
import com.wf.stress.store.StoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;
import java.util.concurrent.Callable;

@Command(
    name = "clean",
    description = "Drop collections left behind by runs made with --no-cleanup",
    mixinStandardHelpOptions = true
)
public class CleanCommand implements Callable<Integer> {

    @Option(names = {"-e", "--endpoint"}, description = "Target address host[:port][,host[:port]...]",
        required = true)
    private List<String> endpoints;

    @Option(names = {"-d", "--database"}, description = "Target database name", defaultValue = "stress")
    private String database;

    @Option(names = {"-P", "--collection-prefix"}, description = "Prefix of the collections to drop",
        defaultValue = "stress_")
    private String collectionPrefix;

    @Option(names = {"-u", "--username"}, description = "User name, if the store requires authentication")
    private String username;

    @Option(names = {"-p", "--password"}, description = "Password for --username", interactive = true, arity = "0..1")
    private String password;

    @Option(names = {"--tls"}, description = "Connect using TLS")
    private boolean tls;

    @Option(names = {"-y", "--yes"}, description = "Skip confirmation prompt", defaultValue = "false")
    private boolean skipConfirmation;

    private StoreClientFactory clientFactory;
    private InputStream in = System.in;
    private PrintStream out = System.out;

    public CleanCommand() {
    }

    CleanCommand(StoreClientFactory clientFactory, InputStream in, PrintStream out) {
        this.clientFactory = clientFactory;
        this.in = in;
        this.out = out;
    }

    @Override
    public Integer call() {
        List<Endpoint> targets;
        try {
            if (collectionPrefix == null || collectionPrefix.isEmpty()) {
                throw new ConfigException("A non-empty --collection-prefix is required");
            }
            targets = new EndpointParser().parseAll(endpoints);
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        }

        if (!skipConfirmation && !confirm(targets)) {
            out.println("Aborted.");
            return ExitCodes.OK;
        }

        try {
            return executeClean(targets);
        } catch (Exception e) {
            System.err.println("Error during clean: " + e.getMessage());
            e.printStackTrace();
            return ExitCodes.FAILURE;
        }
    }

    private boolean confirm(List<Endpoint> targets) {
        out.println("WARNING: This will delete data from the database.");
        out.printf("Database: %s%n", database);
        out.printf("Endpoints: %s%n", targets);
        out.printf("Collections: every collection starting with '%s'%n", collectionPrefix);
        out.print("\nAre you sure? (yes/no): ");

        Scanner scanner = new Scanner(in);
        if (!scanner.hasNextLine()) {
            return false;
        }
        String response = scanner.nextLine().trim().toLowerCase(Locale.ROOT);
        return response.equals("yes") || response.equals("y");
    }

    private int executeClean(List<Endpoint> targets) {
        StoreClientFactory factory = clientFactory != null ? clientFactory : defaultFactory();
        int failures = 0;

        for (Endpoint endpoint : targets) {
            try (StoreClient store = factory.connect(endpoint)) {
                List<String> names = store.listContainers(collectionPrefix);
                out.printf("%s: dropping %d collections%n", endpoint, names.size());

                ContainerProvisioner provisioner =
                    new ContainerProvisioner(store, new RandomDataProvider(), collectionPrefix);
                List<StoreException> errors = provisioner.deleteContainers(names);
                failures += errors.size();
            } catch (StoreException e) {
                System.err.printf("%s: %s%n", endpoint, e.getMessage());
                failures++;
            }
        }

        if (failures == 0) {
            out.println("Collections dropped.");
            return ExitCodes.OK;
        }
        out.printf("%d collections could not be dropped.%n", failures);
        return ExitCodes.FAILURE;
    }

    private StoreClientFactory defaultFactory() {
        ConnectionConfig config = new ConnectionConfig();
        config.setDatabase(database);
        config.setTls(tls);
        if (username != null) {
            config.setUsername(username);
        }
        if (password != null) {
            config.setPassword(password);
        }
        return endpoint -> MongoStoreClient.connect(config, endpoint);
    }
}

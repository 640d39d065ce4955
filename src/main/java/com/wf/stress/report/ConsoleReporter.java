package com.wf.stress.report;

import com.wf.stress.config.Endpoint;
import com.wf.stress.config.StressConfig;
import com.wf.stress.loader.RunResult;
import com.wf.stress.loader.RunSummary;
import com.wf.stress.loader.TargetResult;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Console reporter for stress runs.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream out;
    private final boolean quiet;

    public ConsoleReporter(boolean quiet) {
        this(System.out, quiet);
    }

    public ConsoleReporter(PrintStream out, boolean quiet) {
        this.out = out;
        this.quiet = quiet;
    }

    public void printRunHeader(StressConfig config, List<Endpoint> endpoints) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("                  Document Store Stress Tool - Write Load");
        out.println(SEPARATOR);
        out.println();
        out.printf("Database:        %s%n", config.getConnection().getDatabase());
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Endpoints:");
        for (Endpoint endpoint : endpoints) {
            out.printf("  %s%n", endpoint);
        }
        out.println();
        out.println("Configuration:");
        printConfiguration(config);
        out.println();
    }

    private void printConfiguration(StressConfig config) {
        out.printf("  Containers:      %d per endpoint (prefix '%s', %d shards)%n",
            config.getContainers(), config.getCollectionPrefix(), config.getNumberOfShards());
        out.printf("  Documents:       %,d (+ %d variants)%n", config.getDocuments(), config.getVariants());
        out.printf("  Max Fields:      %d per document, %d chars per field%n",
            config.getMaxFieldsPerDocument(), config.getMaxSizePerField());
        out.printf("  Workers:         %d per endpoint%n", config.getWorkers());
        out.printf("  Batch Size:      %d%n", config.getBatchSize());
        out.printf("  Duration:        %d seconds%n", config.getSeconds());
        out.printf("  Write Concern:   %s%n", config.getConnection().getWriteConcern());
        out.printf("  Wait Healthy:    %s%n",
            config.isWaitForHealthy() ? "yes (" + config.getHealthTimeoutSeconds() + "s timeout)" : "no");
        out.printf("  Cleanup:         %s%n", config.isNoCleanup() ? "no" : "yes");
    }

    public void printDryRun(StressConfig config, List<Endpoint> endpoints) {
        out.println("\n=== DRY RUN - Nothing will be created or written ===\n");
        out.println("Endpoints:");
        for (Endpoint endpoint : endpoints) {
            out.printf("  %s%n", endpoint);
        }
        out.println("\nConfiguration:");
        printConfiguration(config);
        out.printf("  ─────────────────────%n");
        out.printf("  Total workers:   %d%n", config.getWorkers() * endpoints.size());
        out.printf("  Containers:      %d%n", config.getContainers() * endpoints.size());
    }

    public void printEndpointReady(Endpoint endpoint, int containers) {
        if (quiet) return;
        out.printf("Endpoint %s: %d containers created%n", endpoint, containers);
    }

    public void printHealthTimeout(Endpoint endpoint, String reason) {
        out.printf("Endpoint %s: store timeout (%s). Cleaning up its containers and skipping it.%n",
            endpoint, reason);
    }

    public void printRunStart(StressConfig config, int workers) {
        if (quiet) return;
        out.println();
        out.printf("Starting the test with %d workers. Will print stats every %d seconds.%n",
            workers, config.getStatsFrequency());
        out.printf("The test will run for %d seconds, but it may take a bit longer "
            + "while in-flight batches complete.%n%n", config.getSeconds());
    }

    public void printInterrupted() {
        out.println();
        out.println("Interrupt received! Stopping workers...");
    }

    public void printProgress(RunSummary summary) {
        if (quiet) return;
        printSummaryLines(summary);
        out.println();
    }

    public void printCleanup(int containers, int errors) {
        if (quiet) return;
        if (errors == 0) {
            out.printf("Cleaned up %d containers.%n", containers);
        } else {
            out.printf("Cleaned up %d of %d containers (%d could not be deleted).%n",
                containers - errors, containers, errors);
        }
    }

    public void printFinalResults(RunResult result) {
        if (quiet) {
            printFinalResultsCompact(result);
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.println(result.isInterrupted()
            ? "                     Results Summary (interrupted)"
            : "                           Results Summary");
        out.println(SEPARATOR);
        out.println();
        out.printf("%-28s %10s %10s %10s %10s %8s%n",
            "Endpoint", "Batches", "Documents", "Failed", "MB", "MB/s");
        out.println(THIN_SEPARATOR);

        for (TargetResult target : result.getTargets()) {
            if (!target.isRan()) {
                out.printf("%-28s %s%n", abbreviate(target.getEndpoint()), target.isHealthWaitInterrupted()
                    ? "(skipped: interrupted before store was healthy)"
                    : "(skipped: store not healthy)");
                continue;
            }
            RunSummary s = target.getSummary();
            out.printf("%-28s %,10d %,10d %,10d %10.1f %8.2f%n",
                abbreviate(target.getEndpoint()), s.getSuccessBatches(), s.getSuccessDocuments(),
                s.getFailedBatches(), s.getMegabytes(), s.getMegabytesPerSecond());
        }

        out.println(THIN_SEPARATOR);
        RunSummary total = result.getTotal();
        out.printf("%-28s %,10d %,10d %,10d %10.1f %8.2f%n",
            "TOTAL", total.getSuccessBatches(), total.getSuccessDocuments(),
            total.getFailedBatches(), total.getMegabytes(), total.getMegabytesPerSecond());
        out.println();
        printSummaryLines(total);
        out.printf("Completed: %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println(SEPARATOR);
    }

    private void printFinalResultsCompact(RunResult result) {
        RunSummary total = result.getTotal();
        out.printf("%d batches (%d documents) ok, %d batches failed, %.1f MB in %.0fs (%.2f MB/s)%s%n",
            total.getSuccessBatches(), total.getSuccessDocuments(), total.getFailedBatches(),
            total.getMegabytes(), total.getElapsedSeconds(), total.getMegabytesPerSecond(),
            result.isInterrupted() ? " [interrupted]" : "");
    }

    private void printSummaryLines(RunSummary summary) {
        out.printf("Elapsed time: %.0f seconds%n", summary.getElapsedSeconds());
        out.printf("Successful batches: %,d (%,d documents)%n",
            summary.getSuccessBatches(), summary.getSuccessDocuments());
        out.printf("Failed batches: %,d (%,d documents)%n",
            summary.getFailedBatches(), summary.getFailedDocuments());
        out.printf("Wrote approximately %.1f MB which is %.2f MB/s%n",
            summary.getMegabytes(), summary.getMegabytesPerSecond());
    }

    private static String abbreviate(String text) {
        return text.length() <= 28 ? text : text.substring(0, 25) + "...";
    }
}

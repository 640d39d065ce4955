package com.wf.stress.report;

import com.wf.stress.config.Endpoint;
import com.wf.stress.config.StressConfig;
import com.wf.stress.loader.RunResult;
import com.wf.stress.loader.RunSummary;
import com.wf.stress.loader.StatsSnapshot;
import com.wf.stress.loader.TargetResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
    }

    private ConsoleReporter reporter(boolean quiet) {
        return new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), quiet);
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static RunResult sampleResult(boolean interrupted) {
        RunSummary ok = RunSummary.derive(new StatsSnapshot(10, 2, 10_485_760, 5), 1000);
        RunSummary none = RunSummary.derive(new StatsSnapshot(0, 0, 0, 0), 1000);
        return new RunResult(List.of(
            new TargetResult("db1:27017", true, false, 5, 0, ok),
            new TargetResult("db2:27017", false, false, 5, 0, none)), ok, interrupted);
    }

    @Test
    void shouldPrintProgressWithSuccessAndFailureCounts() {
        reporter(false).printProgress(RunSummary.derive(new StatsSnapshot(10, 2, 10_485_760, 5), 1000));

        assertThat(printed())
            .contains("Elapsed time: 5 seconds")
            .contains("Successful batches: 10 (")
            .contains("Failed batches: 2 (")
            .containsPattern("10[.,]0 MB which is 2[.,]00 MB/s");
    }

    @Test
    void shouldPrintPerEndpointRowsAndTotal() {
        reporter(false).printFinalResults(sampleResult(false));

        assertThat(printed())
            .contains("Results Summary")
            .contains("db1:27017")
            .contains("db2:27017")
            .contains("skipped")
            .contains("TOTAL");
    }

    @Test
    void shouldMarkInterruptedRuns() {
        reporter(false).printFinalResults(sampleResult(true));

        assertThat(printed()).contains("interrupted");
    }

    @Test
    void shouldExplainEndpointSkippedByInterrupt() {
        RunSummary none = RunSummary.derive(new StatsSnapshot(0, 0, 0, 0), 1000);
        RunResult result = new RunResult(List.of(
            new TargetResult("db3:27017", false, true, 5, 0, none)), none, true);

        reporter(false).printFinalResults(result);

        assertThat(printed())
            .contains("(skipped: interrupted before store was healthy)")
            .doesNotContain("store not healthy)");
    }

    @Test
    void shouldPrintCompactLineWhenQuiet() {
        ConsoleReporter quiet = reporter(true);

        quiet.printProgress(RunSummary.derive(new StatsSnapshot(1, 1, 1, 1), 1));
        quiet.printFinalResults(sampleResult(false));

        assertThat(printed().trim().lines()).hasSize(1);
        assertThat(printed()).contains("10 batches (10000 documents) ok, 2 batches failed");
    }

    @Test
    void shouldReportPartialCleanup() {
        reporter(false).printCleanup(5, 2);

        assertThat(printed()).contains("Cleaned up 3 of 5 containers (2 could not be deleted)");
    }

    @Test
    void shouldPrintDryRunPlan() {
        StressConfig config = new StressConfig();
        config.setWorkers(3);
        config.setContainers(2);

        reporter(false).printDryRun(config, List.of(
            new Endpoint(List.of("a"), 27017), new Endpoint(List.of("b"), 27017)));

        assertThat(printed())
            .contains("DRY RUN")
            .contains("Total workers:   6")
            .contains("Containers:      4");
    }
}

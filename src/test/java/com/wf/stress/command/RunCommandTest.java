package com.wf.stress.command;

import com.wf.stress.config.StressConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RunCommandTest {

    @Test
    void shouldApplyCommandLineOptions() throws IOException {
        RunCommand command = new RunCommand();
        new CommandLine(command).parseArgs(
            "-e", "a:27018,b:27018", "-e", "c",
            "-n", "7", "--documents", "50", "-w", "3", "-s", "90", "-b", "200",
            "--max-fields-per-document", "4", "--max-size-per-field", "8",
            "--no-cleanup", "--no-wait-healthy", "--stats-frequency", "10",
            "-d", "bench", "-P", "run_", "--write-concern", "majority", "--tls");

        StressConfig config = command.buildConfig();

        assertThat(config.getEndpoints()).containsExactly("a:27018,b:27018", "c");
        assertThat(config.getContainers()).isEqualTo(7);
        assertThat(config.getDocuments()).isEqualTo(50);
        assertThat(config.getWorkers()).isEqualTo(3);
        assertThat(config.getSeconds()).isEqualTo(90);
        assertThat(config.getBatchSize()).isEqualTo(200);
        assertThat(config.getMaxFieldsPerDocument()).isEqualTo(4);
        assertThat(config.getMaxSizePerField()).isEqualTo(8);
        assertThat(config.isNoCleanup()).isTrue();
        assertThat(config.isWaitForHealthy()).isFalse();
        assertThat(config.getStatsFrequency()).isEqualTo(10);
        assertThat(config.getCollectionPrefix()).isEqualTo("run_");
        assertThat(config.getConnection().getDatabase()).isEqualTo("bench");
        assertThat(config.getConnection().getWriteConcern()).isEqualTo("majority");
        assertThat(config.getConnection().isTls()).isTrue();
    }

    @Test
    void shouldLetCommandLineOverrideConfigFile() throws IOException, URISyntaxException {
        String yaml = Path.of(getClass().getResource("/stress-test.yaml").toURI()).toString();
        RunCommand command = new RunCommand();
        new CommandLine(command).parseArgs("-f", yaml, "-w", "2");

        StressConfig config = command.buildConfig();

        assertThat(config.getWorkers()).isEqualTo(2);
        assertThat(config.getBatchSize()).isEqualTo(250);
        assertThat(config.getEndpoints()).hasSize(2);
    }

    @Test
    void shouldExitWithConfigErrorForInvalidBounds() {
        int exitCode = new CommandLine(new RunCommand())
            .execute("-e", "localhost", "--max-fields-per-document", "0");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void shouldExitWithConfigErrorForMismatchedPorts() {
        int exitCode = new CommandLine(new RunCommand()).execute("-e", "a:1,b:2", "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void shouldExitWithConfigErrorWithoutEndpoint() {
        int exitCode = new CommandLine(new RunCommand()).execute("--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void shouldSucceedOnDryRun() {
        int exitCode = new CommandLine(new RunCommand()).execute("-e", "localhost", "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
    }

    @Test
    void shouldExitWithConfigErrorForMistypedYamlValue(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("mistyped.yaml");
        Files.writeString(file, "connection:\n  endpoints: [localhost]\nstress:\n  seconds: \"60s\"\n");

        int exitCode = new CommandLine(new RunCommand()).execute("-f", file.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void shouldExitWithConfigErrorForMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yaml");
        Files.writeString(file, "stress: [workers: 2\n  seconds: {\n");

        int exitCode = new CommandLine(new RunCommand()).execute("-f", file.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void shouldAcceptSingleEndpointScalarInYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("scalar.yaml");
        Files.writeString(file, "connection:\n  endpoints: localhost\n");
        RunCommand command = new RunCommand();
        new CommandLine(command).parseArgs("-f", file.toString());

        assertThat(command.buildConfig().getEndpoints()).containsExactly("localhost");
    }
}

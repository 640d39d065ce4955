package com.wf.stress;

import ch.qos.logback.classic.Level;
import com.wf.stress.command.CleanCommand;
import com.wf.stress.command.RunCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "wf-stress",
    mixinStandardHelpOptions = true,
    version = "wf-stress 1.0.0",
    description = "Write-load stress tool for MongoDB-compatible document stores",
    subcommands = {
        RunCommand.class,
        CleanCommand.class
    }
)
public class WfStressCli implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        WfStressCli cli = new WfStressCli();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(parseResult -> {
                if (cli.verbose) {
                    enableVerboseLogging();
                }
                return new CommandLine.RunLast().execute(parseResult);
            });
    }

    static void enableVerboseLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger("com.wf.stress");
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}

package ai.storefront.translator.cli;

import ai.storefront.translator.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "storefront-translator", mixinStandardHelpOptions = true,
        description = "Bulk storefront content translator",
        subcommands = {
                RunCommand.class,
                CreateJobCommand.class,
                CancelJobCommand.class,
                RetryJobCommand.class,
                ProgressCommand.class
        })
public class CliArguments {

    @CommandLine.Option(names = "--db", description = "SQLite database file", paramLabel = "PATH")
    private Path databasePath;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--providers", description = "Comma-separated provider chain, e.g. openai,anthropic", paramLabel = "LIST")
    private String providers;

    @CommandLine.Option(names = "--max-concurrency", description = "Maximum number of jobs running at once", paramLabel = "COUNT")
    private Integer maxConcurrency;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Path databasePath() {
        return databasePath;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String providers() {
        return providers;
    }

    public Integer maxConcurrency() {
        return maxConcurrency;
    }

    public boolean verbose() {
        return verbose;
    }
}

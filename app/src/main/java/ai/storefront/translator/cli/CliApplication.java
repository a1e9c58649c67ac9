package ai.storefront.translator.cli;

import ai.storefront.translator.config.Config;
import ai.storefront.translator.config.ConfigLoader;
import ai.storefront.translator.config.SystemEnvironmentReader;
import ai.storefront.translator.engine.TranslationEngine;
import ai.storefront.translator.job.JobNotFoundException;
import ai.storefront.translator.logging.LoggingConfigurator;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, TranslationEngine> engineFactory;
    private PrintWriter out;
    private PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), TranslationEngine::fromConfig);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, TranslationEngine> engineFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    CliApplication withOutput(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
        return this;
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
        }
        if (err != null) {
            commandLine.setErr(err);
        }

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            ex.getCommandLine().getErr().println(ex.getMessage());
            ex.getCommandLine().usage(ex.getCommandLine().getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (CommandLine.printHelpIfRequested(parseResult)) {
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (!parseResult.hasSubcommand()) {
            commandLine.getErr().println("Missing command");
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        EngineCommand command = (EngineCommand) parseResult.subcommand().commandSpec().userObject();
        PrintWriter output = commandLine.getOut();
        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
            try (TranslationEngine engine = engineFactory.apply(config)) {
                return command.execute(engine, output);
            }
        } catch (JobNotFoundException ex) {
            commandLine.getErr().println(ex.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("{}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return 1;
        } finally {
            output.flush();
            commandLine.getErr().flush();
        }
    }
}

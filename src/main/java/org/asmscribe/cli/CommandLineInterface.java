package org.asmscribe.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.asmscribe.cli.commands.AnnotateCommand;
import org.asmscribe.cli.config.ConfigLoader;
import org.asmscribe.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "asmscribe",
    mixinStandardHelpOptions = true,
    version = "asmscribe 1.0",
    description = "Turns compiler-generated x86-64 assembly into an annotated, human-readable listing",
    subcommands = {
        AnnotateCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration:",
        "  Defaults come from reference.conf. Override them in config/asmscribe.conf,",
        "  with --config FILE, or with system properties, e.g.",
        "",
        "    -Dasmscribe.rendering.comment-column=72"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/asmscribe.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("asmscribe");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException                if the named configuration file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
            LoggingConfigurator.configure(resolved);
            config = resolved;
        }
        return config;
    }
}

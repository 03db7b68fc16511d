package com.docpublish;

import ch.qos.logback.classic.Level;
import com.docpublish.cli.ListCommand;
import com.docpublish.cli.PublishCommand;
import com.docpublish.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocPublish.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code publish} - Read a document, transform it and write it in an output format</li>
 *   <li>{@code list} - List writers, transforms or configuration options</li>
 *   <li>{@code validate} - Check configuration files</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Publish a document as HTML into ./site
 * docpublish publish guide.txt --writer html --output site
 *
 * # Show the settings a run would use
 * docpublish publish guide.txt --dump-settings
 *
 * # List available writers
 * docpublish list writers
 * }</pre>
 */
@Command(
    name = "docpublish",
    mixinStandardHelpOptions = true,
    version = "DocPublish 1.0.0-SNAPSHOT",
    description = "Reads plain-text documents, transforms them and publishes them in several formats",
    subcommands = {
        PublishCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class DocPublishCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocPublishCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocPublish - Document Publishing Pipeline");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docpublish --help' to see available commands");
        System.out.println("Use 'docpublish <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DocPublishCLI cli = new DocPublishCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

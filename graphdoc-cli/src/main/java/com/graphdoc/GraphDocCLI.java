package com.graphdoc;

import ch.qos.logback.classic.Level;
import com.graphdoc.cli.GenerateCommand;
import com.graphdoc.cli.ListCommand;
import com.graphdoc.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for GraphDoc.
 *
 * <p>GraphDoc writes Org documentation for graph scripts, custom nodes and packages and
 * keeps the text authors added to previously generated documents.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Regenerate all documents</li>
 *   <li>{@code validate} - Check that every annotation can be linked to a node</li>
 *   <li>{@code list} - List sections, scripts or packages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * graphdoc -v generate -s ./graphs -o ./docs/org
 * graphdoc list sections
 * }</pre>
 */
@Command(
    name = "graphdoc",
    mixinStandardHelpOptions = true,
    version = "GraphDoc 1.0.0-SNAPSHOT",
    description = "Documentation generator for visual programming graphs",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class GraphDocCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GraphDocCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("GraphDoc - Documentation generator for visual programming graphs");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'graphdoc --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options.
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        GraphDocCLI cli = new GraphDocCLI();
        CommandLine commandLine = new CommandLine(cli);
        CommandLine.IExecutionStrategy strategy = commandLine.getExecutionStrategy();
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return strategy.execute(parseResult);
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

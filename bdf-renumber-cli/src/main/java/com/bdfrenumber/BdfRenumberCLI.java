package com.bdfrenumber;

import ch.qos.logback.classic.Level;
import com.bdfrenumber.cli.RenumberCommand;
import com.bdfrenumber.cli.ScanCommand;
import com.bdfrenumber.cli.SuggestCommand;
import com.bdfrenumber.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the BDF include renumbering tool.
 *
 * <p>Renumbers the nodes, elements, properties, materials, coordinate systems
 * and sets of a Nastran deck so that every include file owns a distinct ID
 * range, rewriting every reference consistently.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Show the include tree and the IDs each file defines</li>
 *   <li>{@code suggest} - Propose one range per file</li>
 *   <li>{@code validate} - Check ranges without writing anything</li>
 *   <li>{@code renumber} - Renumber and write the deck</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 success, 2 success with warnings, 1 failure.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * bdf-renumber scan model.bdf
 * bdf-renumber suggest model.bdf --start 1 --save ranges.json
 * bdf-renumber renumber model.bdf --snapshot ranges.json -o renumbered
 * bdf-renumber -v renumber model.bdf --range model.bdf=1:999 --range includes/wing.bdf=1000:1999 -o out
 * }</pre>
 */
@Command(
    name = "bdf-renumber",
    mixinStandardHelpOptions = true,
    version = "bdf-renumber 1.0.0-SNAPSHOT",
    description = "Renumbers Nastran bulk data IDs into per-include-file ranges",
    subcommands = {
        ScanCommand.class,
        SuggestCommand.class,
        ValidateCommand.class,
        RenumberCommand.class
    }
)
public class BdfRenumberCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BdfRenumberCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("bdf-renumber - Nastran include file renumbering");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'bdf-renumber --help' to see available commands");
        System.out.println("Use 'bdf-renumber <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine createCommandLine() {
        BdfRenumberCLI cli = new BdfRenumberCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}

package com.bdfrenumber.cli;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.config.RenumberConfig;
import com.bdfrenumber.core.config.SnapshotStore;
import com.bdfrenumber.core.engine.RenumberEngine;
import com.bdfrenumber.core.engine.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to renumber a deck and write the result.
 *
 * <p>Scans, validates, renumbers, writes and checks the written deck.
 * Nothing is written when validation fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bdf-renumber renumber model.bdf --snapshot ranges.json -o renumbered
 * }</pre>
 */
@Command(
    name = "renumber",
    description = "Renumber the deck into the given ranges and write it",
    mixinStandardHelpOptions = true
)
public class RenumberCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenumberCommand.class);

    @Parameters(index = "0", description = "Root deck file")
    private Path deck;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Mixin
    private RangeOptions rangeOptions;

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        try {
            RangeOptions.Selection selection = rangeOptions.resolve(new SnapshotStore());
            RenumberConfig config = Commands.effectiveConfig(configOptions.load(deck), selection);
            Path target = outputDir != null ? outputDir : Path.of(config.output().directory());
            if (target.toAbsolutePath().normalize().equals(deck.toAbsolutePath().normalize().getParent())) {
                System.err.println("✗ The output directory must differ from the deck's directory");
                return 1;
            }

            System.out.println("Renumbering " + deck.toAbsolutePath() + " into " + target.toAbsolutePath());
            RunResult result = new RenumberEngine(config).run(deck, selection.mode(), selection.table(), target);

            ReportPrinter.print(result.report(), System.out);
            if (result.isWritten()) {
                System.out.println("✓ Wrote " + result.writtenFiles().size() + " file(s)");
                System.out.println("✓ Changed " + result.plan().maps().changedCount() + " ID(s)");
            } else {
                System.out.println("✗ Nothing was written");
            }
            ReportPrinter.printStatus("Renumbering", result.status(), result.report(), System.out);
            return result.status().exitCode();
        } catch (IllegalArgumentException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (RenumberException e) {
            log.error("Renumbering failed", e);
            System.err.println("✗ Renumbering failed: " + e.getMessage());
            return 1;
        }
    }
}

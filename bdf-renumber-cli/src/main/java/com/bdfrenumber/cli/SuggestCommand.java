package com.bdfrenumber.cli;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.config.RangeSnapshot;
import com.bdfrenumber.core.config.RenumberConfig;
import com.bdfrenumber.core.config.SnapshotStore;
import com.bdfrenumber.core.engine.RenumberEngine;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeTable;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to propose one range per file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bdf-renumber suggest model.bdf --start 1 --save ranges.json
 * }</pre>
 */
@Command(
    name = "suggest",
    description = "Suggest one ID range per file, each ending on a round number",
    mixinStandardHelpOptions = true
)
public class SuggestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SuggestCommand.class);

    @Parameters(index = "0", description = "Root deck file")
    private Path deck;

    @Option(names = {"--start"}, description = "First ID of the first file (default: ${DEFAULT-VALUE})", defaultValue = "1")
    private int start;

    @Option(names = {"--save"}, description = "Save the suggestion as a range snapshot")
    private Path save;

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        if (start < 1) {
            System.err.println("✗ --start must be at least 1");
            return 1;
        }
        try {
            RenumberConfig config = configOptions.load(deck);
            RenumberEngine engine = new RenumberEngine(config);
            ScanResult scan = engine.scan(deck);
            if (scan.hasErrors()) {
                ReportPrinter.print(scan.report(), System.out);
                System.err.println("✗ Fix the scan errors before suggesting ranges");
                return 1;
            }

            Map<String, IdRange> suggestion = engine.suggest(scan, start);
            suggestion.forEach((file, range) ->
                System.out.printf("  %-40s %10d %10d%n", file, range.start(), range.end()));

            if (save != null) {
                RangeSnapshot snapshot = RangeSnapshot.of(AllocationMode.SIMPLE, config.renumberSetIds(),
                    RangeTable.simple(suggestion));
                new SnapshotStore().save(snapshot, save);
                System.out.println("✓ Saved ranges to: " + save);
            }
            log.info("Suggested {} range(s) starting at {}", suggestion.size(), start);
            return 0;
        } catch (RenumberException e) {
            log.error("Suggest failed", e);
            System.err.println("✗ Suggest failed: " + e.getMessage());
            return 1;
        }
    }
}

package com.bdfrenumber.cli;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.config.SnapshotStore;
import com.bdfrenumber.core.engine.RenumberEngine;
import com.bdfrenumber.core.model.RunStatus;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to check ranges against a deck without writing anything.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bdf-renumber validate model.bdf --range model.bdf=1:999 --range wing.bdf=1000:1999
 * bdf-renumber validate model.bdf --snapshot ranges.json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check ranges for capacity, overlap and positivity without writing",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Root deck file")
    private Path deck;

    @Mixin
    private RangeOptions rangeOptions;

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        try {
            RangeOptions.Selection selection = rangeOptions.resolve(new SnapshotStore());
            RenumberEngine engine = new RenumberEngine(
                Commands.effectiveConfig(configOptions.load(deck), selection));

            ScanResult scan = engine.scan(deck);
            RangePlan plan = engine.plan(scan, selection.mode(), selection.table());
            BulkModel model = engine.read(deck);
            ValidationReport report = engine.validate(model, plan);

            System.out.println("Validating " + selection.mode() + " ranges for " + scan.tree().size() + " file(s)");
            ReportPrinter.print(report, System.out);
            RunStatus status = RunStatus.of(report);
            ReportPrinter.printStatus("Validation", status, report, System.out);
            return status.exitCode();
        } catch (IllegalArgumentException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (RenumberException e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}

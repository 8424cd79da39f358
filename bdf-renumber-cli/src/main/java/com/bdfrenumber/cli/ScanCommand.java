package com.bdfrenumber.cli;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.engine.RenumberEngine;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.RunStatus;
import com.bdfrenumber.core.scanner.NamespaceSummary;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to show the include tree and the IDs each file defines.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bdf-renumber scan model.bdf
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Show the include tree and the ID catalog of every file",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(index = "0", description = "Root deck file")
    private Path deck;

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        try {
            RenumberEngine engine = new RenumberEngine(configOptions.load(deck));
            ScanResult scan = engine.scan(deck);

            System.out.println("Include tree of " + deck.toAbsolutePath());
            System.out.println();
            for (Map.Entry<String, Map<Namespace, NamespaceSummary>> file : scan.summary().entrySet()) {
                System.out.println(file.getKey());
                if (file.getValue().isEmpty()) {
                    System.out.println("    (no IDs)");
                }
                file.getValue().forEach((namespace, summary) -> System.out.printf(
                    "    %-20s %8d  [%d-%d]%n", namespace.label(), summary.count(), summary.min(), summary.max()));
            }
            System.out.println();
            System.out.println("✓ Scanned " + scan.tree().size() + " file(s)");

            ReportPrinter.print(scan.report(), System.out);
            RunStatus status = RunStatus.of(scan.report());
            ReportPrinter.printStatus("Scan", status, scan.report(), System.out);
            return status.exitCode();
        } catch (RenumberException e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }
}

package com.bdfrenumber.cli;

import com.bdfrenumber.core.config.RangeSnapshot;
import com.bdfrenumber.core.config.SnapshotStore;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeTable;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Range options of the {@code validate} and {@code renumber} commands.
 */
public class RangeOptions {

    @Option(
        names = {"-r", "--range"},
        description = "Range per file (file=start:end), or per file and namespace with --advanced (file:nid=start:end)"
    )
    List<String> ranges = new ArrayList<>();

    @Option(
        names = {"-s", "--snapshot"},
        description = "Range snapshot saved by 'suggest --save'"
    )
    Path snapshot;

    @Option(
        names = {"--advanced"},
        description = "Read --range arguments as per-namespace ranges"
    )
    boolean advanced;

    /**
     * Resolved ranges: the snapshot when given, else the range arguments.
     *
     * @param store snapshot store
     * @return mode and range table
     * @throws IllegalArgumentException if neither ranges nor a snapshot were given
     */
    Selection resolve(SnapshotStore store) {
        if (snapshot != null) {
            if (!ranges.isEmpty()) {
                throw new IllegalArgumentException("Use either --range or --snapshot, not both");
            }
            RangeSnapshot saved = store.load(snapshot);
            return new Selection(saved.mode(), saved.toRangeTable(), saved.renumberSetIds());
        }
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("No ranges given: use --range or --snapshot");
        }
        AllocationMode mode = advanced ? AllocationMode.ADVANCED : AllocationMode.SIMPLE;
        return new Selection(mode, RangeSpecs.parse(ranges, mode), null);
    }

    /**
     * Ranges to apply.
     *
     * @param mode allocation mode
     * @param table range table
     * @param renumberSetIds set renumbering stored in the snapshot, or null
     */
    record Selection(AllocationMode mode, RangeTable table, Boolean renumberSetIds) {
    }
}

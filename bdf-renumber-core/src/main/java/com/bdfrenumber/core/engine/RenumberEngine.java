package com.bdfrenumber.core.engine;

import com.bdfrenumber.core.bulk.BulkDataRepository;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.bulk.ModelRepository;
import com.bdfrenumber.core.config.RenumberConfig;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeAllocator;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.plan.RangeTable;
import com.bdfrenumber.core.renumber.CaseControlRenumberer;
import com.bdfrenumber.core.renumber.RecordRenumberer;
import com.bdfrenumber.core.scanner.IncludeScanner;
import com.bdfrenumber.core.scanner.ScanResult;
import com.bdfrenumber.core.validation.ModelValidator;
import com.bdfrenumber.core.validation.RangeValidator;
import com.bdfrenumber.core.writer.DeckWriter;
import com.bdfrenumber.core.writer.FileSystemWriter;
import com.bdfrenumber.core.writer.GeneratedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the renumbering pipeline.
 *
 * <p>The pipeline runs scan, plan, validate, apply and write in that order.
 * Each step is exposed on its own so callers can stop after validation;
 * {@link #run} chains them. An engine instance owns one {@link RunContext}
 * holding the latest plan only: {@link #apply} accepts that plan once
 * {@link #validate} passed it for the same model, and a model can be
 * renumbered once.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenumberEngine engine = new RenumberEngine(ConfigLoader.loadFor(deck));
 * RunResult result = engine.run(deck, AllocationMode.SIMPLE,
 *     RangeTable.simple(Map.of("main.bdf", new IdRange(1, 999))), Path.of("out"));
 * }</pre>
 */
public class RenumberEngine {

    private static final Logger log = LoggerFactory.getLogger(RenumberEngine.class);

    private final RenumberConfig config;
    private final ModelRepository repository;
    private final DeckWriter deckWriter;
    private final RunContext context = new RunContext();

    private final RangeAllocator allocator = new RangeAllocator();
    private final RangeValidator rangeValidator = new RangeValidator();
    private final ModelValidator modelValidator = new ModelValidator();
    private final RecordRenumberer recordRenumberer = new RecordRenumberer();
    private final CaseControlRenumberer caseControlRenumberer = new CaseControlRenumberer();
    private final FileSystemWriter fileSystemWriter = new FileSystemWriter();

    public RenumberEngine() {
        this(RenumberConfig.defaults());
    }

    public RenumberEngine(RenumberConfig config) {
        this(config, new BulkDataRepository(), new DeckWriter());
    }

    public RenumberEngine(RenumberConfig config, ModelRepository repository, DeckWriter deckWriter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.deckWriter = Objects.requireNonNull(deckWriter, "deckWriter must not be null");
    }

    /**
     * Discovers the include tree and catalogs the IDs of every file.
     *
     * @param root root deck file
     * @return scan result
     */
    public ScanResult scan(Path root) {
        return new IncludeScanner(config.effectiveDisabledCards()).scan(root);
    }

    /**
     * Proposes one Simple-mode range per file.
     *
     * @param scan include scan
     * @param start first ID of the first file
     * @return file name to suggested range, in discovery order
     */
    public Map<String, IdRange> suggest(ScanResult scan, int start) {
        return allocator.suggest(scan, start, config.renumberSetIds());
    }

    /**
     * Builds the ID maps for a range table.
     *
     * @param scan include scan
     * @param mode how the table is to be read
     * @param ranges requested ranges
     * @return range plan
     */
    public RangePlan plan(ScanResult scan, AllocationMode mode, RangeTable ranges) {
        RangePlan plan = allocator.plan(scan, mode, ranges, config.renumberSetIds());
        context.planned(plan, scan);
        return plan;
    }

    /**
     * Reads the flattened model of a deck.
     *
     * @param root root deck file
     * @return a fresh model
     */
    public BulkModel read(Path root) {
        return repository.read(root, config.effectiveDisabledCards());
    }

    /**
     * Checks a plan before anything is mutated.
     *
     * <p>Reports scan findings, range errors and duplicate IDs in the model.
     * A plan without errors may then be applied to this model.
     *
     * @param model model the plan will be applied to
     * @param plan plan built by {@link #plan}
     * @return complete pre-validation report
     */
    public ValidationReport validate(BulkModel model, RangePlan plan) {
        if (model.isRenumbered()) {
            throw new IllegalStateException("The model has already been renumbered; read it again");
        }
        ScanResult scan = context.scanOf(plan);
        ValidationReport report = ValidationReport.merge(
            scan.report(),
            rangeValidator.validate(scan, plan),
            modelValidator.checkDuplicates(model));

        if (report.hasErrors()) {
            log.warn("Validation failed with {} error(s)", report.errors().size());
        } else {
            context.validated(plan, model);
            log.info("Validation passed ({} warning(s))", report.warnings().size());
        }
        return report;
    }

    /**
     * Renumbers records and case control in place, then checks the result.
     *
     * @param model model validated with the plan
     * @param plan validated plan
     * @return renumbering warnings and post-validation findings
     * @throws IllegalStateException if the plan was not validated without errors for this model,
     *     or the model was already renumbered
     */
    public ValidationReport apply(BulkModel model, RangePlan plan) {
        if (!context.isValidated(plan, model)) {
            throw new IllegalStateException("The plan must pass validation for this model before it is applied");
        }
        if (model.isRenumbered()) {
            throw new IllegalStateException("The model has already been renumbered; read it again");
        }
        log.info("Applying {} ID change(s)", plan.maps().changedCount());

        int rewritten = recordRenumberer.renumber(model, plan.maps());
        CaseControlRenumberer.Result caseControl =
            caseControlRenumberer.renumber(model.controlDeck().caseControlLines(), plan.maps());
        model.setControlDeck(model.controlDeck().withCaseControl(caseControl.lines()));
        context.applied(plan, model);

        RunContext.Counts before = context.countsBefore(model);
        ValidationReport report = ValidationReport.merge(
            caseControl.report(),
            modelValidator.checkCounts(before.namespaces(), before.cards(), model),
            modelValidator.checkReferences(model, plan.maps()));
        log.info("Applied plan to {} card(s): {} error(s), {} warning(s)",
            rewritten, report.errors().size(), report.warnings().size());
        return report;
    }

    /**
     * Writes the renumbered deck and reads it back to compare card counts.
     *
     * @param model renumbered model
     * @param scan scan of the source deck
     * @param plan applied plan
     * @param outputDir output directory
     * @return writer warnings and output check findings
     * @throws IllegalStateException if the plan has not been applied to the model
     * @throws com.bdfrenumber.core.RenumberException if writing or reading back fails
     */
    public ValidationReport write(BulkModel model, ScanResult scan, RangePlan plan, Path outputDir) {
        return writeFiles(model, scan, plan, outputDir).report();
    }

    private Written writeFiles(BulkModel model, ScanResult scan, RangePlan plan, Path outputDir) {
        if (!context.isApplied(plan, model)) {
            throw new IllegalStateException("The plan must be applied to the model before it is written");
        }
        GeneratedOutput output = deckWriter.render(model, scan);
        List<Path> written = fileSystemWriter.write(output, outputDir);

        BulkModel reread = repository.read(written.get(0), scan.disabledCards());
        ValidationReport check = modelValidator.checkOutput(context.countsBefore(model).cards(), reread.cardCounts());
        log.info("Wrote {} file(s) to {}", written.size(), outputDir);
        return new Written(written, output.report().and(check));
    }

    private record Written(List<Path> files, ValidationReport report) {
    }

    /**
     * Runs the whole pipeline. Nothing is written when pre-validation fails
     * or when the renumbered model does not pass post-validation.
     *
     * @param root root deck file
     * @param mode allocation mode
     * @param ranges requested ranges
     * @param outputDir output directory
     * @return run result
     */
    public RunResult run(Path root, AllocationMode mode, RangeTable ranges, Path outputDir) {
        ScanResult scan = scan(root);
        RangePlan plan = plan(scan, mode, ranges);
        BulkModel model = read(root);

        ValidationReport report = validate(model, plan);
        if (report.hasErrors()) {
            return RunResult.of(report, scan, plan, List.of());
        }
        report = report.and(apply(model, plan));
        if (report.hasErrors()) {
            log.warn("Post-validation failed with {} error(s); nothing written", report.errors().size());
            return RunResult.of(report, scan, plan, List.of());
        }
        Written written = writeFiles(model, scan, plan, outputDir);
        report = report.and(written.report());

        RunResult result = RunResult.of(report, scan, plan, written.files());
        log.info("Run finished: {}", result.status());
        return result;
    }
}

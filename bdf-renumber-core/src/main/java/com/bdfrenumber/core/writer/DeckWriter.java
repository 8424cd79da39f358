package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.bulk.BulkCard;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.bulk.CardReader;
import com.bdfrenumber.core.bulk.CardFormatter;
import com.bdfrenumber.core.bulk.ControlDeck;
import com.bdfrenumber.core.bulk.RawCard;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.scanner.IncludeFileNode;
import com.bdfrenumber.core.scanner.IncludeTree;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renders a renumbered model back into one file per source file.
 *
 * <p>Each card goes back to the file it was read from. Within a file, cards
 * are written section by section following the {@link SectionOrder}, sorted
 * by their new primary ID. Known card types the order does not list, and the
 * passthrough cards of the file, are appended after the ordered sections so
 * no record is ever dropped. Each card name copied verbatim is reported once
 * per file.
 *
 * <p>The root file keeps its executive and case control sections and ends
 * with {@code ENDDATA}. Include statements point at the mirrored output
 * paths; files that lived outside the root directory are written under
 * {@value #EXTERNAL_DIRECTORY}.
 */
public class DeckWriter {

    private static final Logger log = LoggerFactory.getLogger(DeckWriter.class);

    static final String EXTERNAL_DIRECTORY = "external";
    static final String FALLBACK_HEADER = "$ Cards written outside the section order";

    private final SectionOrder order;

    public DeckWriter() {
        this(SectionOrder.standard());
    }

    public DeckWriter(SectionOrder order) {
        this.order = Objects.requireNonNull(order, "order must not be null");
    }

    /**
     * Renders the model into deck files.
     *
     * @param model renumbered model
     * @param scan scan of the source deck, used for card provenance
     * @return files root first, with fallback warnings
     */
    public GeneratedOutput render(BulkModel model, ScanResult scan) {
        IncludeTree tree = scan.tree();
        List<String> outputPaths = outputPaths(tree);
        List<Finding> findings = new ArrayList<>();

        List<Map<CardType, List<BulkCard>>> buckets = new ArrayList<>();
        for (int i = 0; i < tree.size(); i++) {
            buckets.add(new EnumMap<>(CardType.class));
        }
        List<BulkCard> unowned = new ArrayList<>();
        for (BulkCard card : model.allCards()) {
            int owner = scan.origins().fileOf(card.name(), card.originalId(), card.occurrence());
            if (owner < 0) {
                findings.add(Finding.warning(FindingCategory.STRUCTURAL,
                    card.name() + " " + card.originalId() + " has no known source file; appended to the root file")
                    .at(outputPaths.get(0), card.type().primaryNamespace(), card.primaryId()));
                unowned.add(card);
                continue;
            }
            buckets.get(owner).computeIfAbsent(card.type(), t -> new ArrayList<>()).add(card);
        }

        List<GeneratedFile> files = new ArrayList<>();
        for (IncludeFileNode node : tree.nodes()) {
            List<String> lines = new ArrayList<>();
            if (node.isRoot()) {
                writeControlDeck(model.controlDeck(), lines);
            } else {
                lines.add("$ Renumbered from: " + tree.relativeName(node.index()));
            }
            writeIncludes(tree, node, outputPaths, lines);
            writeCards(node, buckets.get(node.index()), node.isRoot() ? unowned : List.of(),
                outputPaths.get(node.index()), lines, findings);
            findings.addAll(verbatimWarnings(node, outputPaths.get(node.index()), scan.disabledCards()));
            if (node.isRoot()) {
                lines.add("ENDDATA");
            }
            files.add(new GeneratedFile(outputPaths.get(node.index()), lines, node.index()));
            log.debug("Rendered {} ({} lines)", outputPaths.get(node.index()), lines.size());
        }
        return new GeneratedOutput(files, new ValidationReport(findings));
    }

    private static void writeControlDeck(ControlDeck deck, List<String> lines) {
        if (deck.bulkOnly()) {
            return;
        }
        lines.addAll(deck.executiveLines());
        lines.addAll(deck.caseControlLines());
        lines.add("BEGIN BULK");
    }

    private static void writeIncludes(IncludeTree tree, IncludeFileNode node, List<String> outputPaths,
                                      List<String> lines) {
        Path parent = Path.of(outputPaths.get(node.index())).getParent();
        Path base = parent == null ? Path.of("") : parent;
        for (IncludeFileNode child : tree.children(node.index())) {
            String target = base.relativize(Path.of(outputPaths.get(child.index()))).toString().replace('\\', '/');
            lines.add("INCLUDE '" + target + "'");
        }
    }

    private void writeCards(IncludeFileNode node, Map<CardType, List<BulkCard>> bucket, List<BulkCard> unowned,
                            String fileName, List<String> lines, List<Finding> findings) {
        Comparator<BulkCard> byNewId = Comparator.comparingInt(BulkCard::primaryId);
        for (SectionOrder.Section section : order.sections()) {
            for (CardType type : section.types()) {
                List<BulkCard> cards = bucket.get(type);
                if (cards != null) {
                    cards.stream().sorted(byNewId).forEach(card -> lines.addAll(CardFormatter.format(card)));
                }
            }
        }

        List<String> fallback = new ArrayList<>();
        bucket.forEach((type, cards) -> {
            if (order.contains(type)) {
                return;
            }
            findings.add(Finding.warning(FindingCategory.UNMAPPED_TYPE,
                cards.size() + " " + type.name() + " card(s) are not in the section order; written after it")
                .at(fileName, type.primaryNamespace(), null));
            log.warn("{}: {} {} card(s) outside the section order", fileName, cards.size(), type.name());
            cards.stream().sorted(byNewId).forEach(card -> fallback.addAll(CardFormatter.format(card)));
        });
        for (RawCard raw : node.passthrough()) {
            fallback.addAll(raw.lines());
        }
        unowned.forEach(card -> fallback.addAll(CardFormatter.format(card)));
        if (!fallback.isEmpty()) {
            lines.add(FALLBACK_HEADER);
            lines.addAll(fallback);
        }
    }

    /**
     * One warning per card name copied verbatim into a file. Inert parameter
     * cards carry no IDs and are not reported.
     */
    private static List<Finding> verbatimWarnings(IncludeFileNode node, String fileName, Set<String> disabledCards) {
        Map<String, Integer> verbatim = new TreeMap<>();
        for (RawCard raw : node.passthrough()) {
            Optional<CardType> type = CardReader.typeOf(raw, disabledCards);
            if (type.isPresent() && type.get().isInert()) {
                continue;
            }
            verbatim.merge(raw.name(), 1, Integer::sum);
        }
        List<Finding> findings = new ArrayList<>();
        verbatim.forEach((name, count) -> {
            log.warn("{}: {} {} card(s) copied verbatim without renumbering", fileName, count, name);
            findings.add(Finding.warning(FindingCategory.UNMAPPED_TYPE,
                "Card type " + name + " is not renumbered: " + count + " card(s) copied verbatim")
                .at(fileName, null, null));
        });
        return findings;
    }

    /**
     * Output path of every file, mirroring the source layout below the root directory.
     *
     * @param tree include tree
     * @return relative output paths by node index
     */
    static List<String> outputPaths(IncludeTree tree) {
        List<String> paths = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        Map<Integer, String> external = new LinkedHashMap<>();
        for (int i = 0; i < tree.size(); i++) {
            String name = tree.relativeName(i);
            if (escapesRoot(name)) {
                external.put(i, name);
                paths.add(null);
            } else {
                paths.add(name);
                taken.add(name);
            }
        }
        external.forEach((index, name) -> {
            String fileName = tree.node(index).path().getFileName().toString();
            String candidate = EXTERNAL_DIRECTORY + "/" + fileName;
            if (!taken.add(candidate)) {
                candidate = EXTERNAL_DIRECTORY + "/" + index + "_" + fileName;
                taken.add(candidate);
            }
            log.info("{} lies outside the root directory; writing it as {}", name, candidate);
            paths.set(index, candidate);
        });
        return paths;
    }

    private static boolean escapesRoot(String relativeName) {
        return relativeName.startsWith("../") || relativeName.equals("..")
            || relativeName.startsWith("/") || relativeName.contains(":");
    }
}

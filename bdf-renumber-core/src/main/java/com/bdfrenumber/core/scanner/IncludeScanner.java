package com.bdfrenumber.core.scanner;

import com.bdfrenumber.core.bulk.CardReader;
import com.bdfrenumber.core.bulk.DeckVisitor;
import com.bdfrenumber.core.bulk.DeckWalker;
import com.bdfrenumber.core.bulk.RawCard;
import com.bdfrenumber.core.card.CardReferences;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.card.Fields;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Discovers the include tree of a deck and catalogs the IDs each file defines.
 *
 * <p>Works on raw text, independently of the model repository, because the
 * flattened model no longer knows which file a card came from. A card is
 * catalogued under the file its first line is written in.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanResult scan = new IncludeScanner(Set.of("BCPROPS")).scan(Path.of("model.bdf"));
 * scan.summary().forEach((file, namespaces) -> System.out.println(file + " " + namespaces));
 * }</pre>
 */
public class IncludeScanner {

    private static final Logger log = LoggerFactory.getLogger(IncludeScanner.class);

    private final Set<String> disabledCards;

    public IncludeScanner() {
        this(Set.of());
    }

    public IncludeScanner(Set<String> disabledCards) {
        this.disabledCards = Set.copyOf(disabledCards);
    }

    /**
     * Scans a deck and all of its includes.
     *
     * @param root root deck file
     * @return tree, provenance and structural findings
     * @throws com.bdfrenumber.core.RenumberException if the root cannot be read
     */
    public ScanResult scan(Path root) {
        log.info("Scanning include tree of {}", root);
        Catalog catalog = new Catalog();
        new DeckWalker(catalog).walk(root);

        List<IncludeFileNode> nodes = catalog.files.stream().map(FileBuilder::build).toList();
        IncludeTree tree = new IncludeTree(nodes);
        List<Finding> findings = catalog.locate(tree);

        log.info("Scanned {} file(s): {} ID(s) catalogued, {} finding(s)",
            tree.size(), nodes.stream().mapToInt(IncludeFileNode::totalIds).sum(), findings.size());
        return new ScanResult(tree, catalog.origins, disabledCards, new ValidationReport(findings));
    }

    private final class Catalog implements DeckVisitor {

        private final List<FileBuilder> files = new ArrayList<>();
        private final Map<Path, FileBuilder> byPath = new HashMap<>();
        private final Map<Namespace, Map<Integer, Integer>> owners = new EnumMap<>(Namespace.class);
        private final Map<String, Integer> cardOwners = new HashMap<>();
        private final CardOrigins origins = new CardOrigins();
        private final List<PendingFinding> pending = new ArrayList<>();

        @Override
        public void enterFile(Path file, Path parent) {
            int parentIndex = parent == null ? -1 : byPath.get(parent).index;
            FileBuilder builder = new FileBuilder(files.size(), file, parentIndex);
            files.add(builder);
            byPath.put(file, builder);
            if (parentIndex >= 0) {
                files.get(parentIndex).children.add(builder.index);
            }
            log.debug("Discovered file #{}: {}", builder.index, file);
        }

        @Override
        public void duplicateInclude(Path file, Path parent) {
            log.debug("File {} included again from {}; keeping its first position", file, parent);
        }

        @Override
        public void missingInclude(Path file, Path parent) {
            pending.add(new PendingFinding(
                Finding.error(FindingCategory.STRUCTURAL,
                    "Include file not found: " + file.getFileName() + " (resolved to " + file + ")"),
                parent, null, null));
        }

        @Override
        public void card(Path file, RawCard card) {
            FileBuilder builder = byPath.get(file);
            Optional<CardType> type = CardReader.typeOf(card, disabledCards);
            if (type.isEmpty() || type.get().isInert()) {
                builder.passthrough.add(card);
                return;
            }
            List<String> fields = CardReader.splitFields(card.lines());
            int primaryId = Fields.parseId(fields.size() > 1 ? fields.get(1) : "");
            if (primaryId < 0) {
                log.debug("{}:{}: {} card without a positive primary ID kept as passthrough",
                    file, card.lineNumber(), card.name());
                builder.passthrough.add(card);
                return;
            }

            origins.record(card.name(), primaryId, builder.index);
            for (CardReferences.Reference definition : CardReferences.definitions(type.get(), fields)) {
                for (Fields.IdSpan span : definition.spans()) {
                    for (int id : span.ids()) {
                        claim(builder, definition.target(), id, card);
                    }
                }
            }
        }

        private void claim(FileBuilder builder, Namespace namespace, int id, RawCard card) {
            Map<Integer, Integer> namespaceOwners = owners.computeIfAbsent(namespace, n -> new HashMap<>());
            Integer owner = namespaceOwners.putIfAbsent(id, builder.index);
            if (owner == null || owner == builder.index) {
                builder.ids.computeIfAbsent(namespace, n -> new TreeSet<>()).add(id);
                cardOwners.putIfAbsent(card.name() + "#" + id, builder.index);
                return;
            }
            String ownerName = files.get(owner).path.getFileName().toString();
            String message = namespace.label() + " " + id + " (" + card.name() + ") is defined in both "
                + ownerName + " and " + builder.path.getFileName();
            Finding finding = isExclusive(namespace, card.name(), id, builder.index)
                ? Finding.error(FindingCategory.STRUCTURAL, message)
                : Finding.warning(FindingCategory.STRUCTURAL, message + "; " + ownerName + " owns it");
            pending.add(new PendingFinding(finding, builder.path, namespace, id));
        }

        private boolean isExclusive(Namespace namespace, String cardName, int id, int fileIndex) {
            return switch (namespace.uniqueness()) {
                case NAMESPACE -> true;
                case CARD_TYPE -> {
                    Integer first = cardOwners.putIfAbsent(cardName + "#" + id, fileIndex);
                    yield first != null && first != fileIndex;
                }
                case NONE -> false;
            };
        }

        List<Finding> locate(IncludeTree tree) {
            return pending.stream()
                .map(p -> p.finding().at(
                    FileUtils.relativeName(tree.rootDirectory(), p.file()), p.namespace(), p.id()))
                .toList();
        }
    }

    private record PendingFinding(Finding finding, Path file, Namespace namespace, Integer id) {
    }

    private static final class FileBuilder {
        private final int index;
        private final Path path;
        private final int parentIndex;
        private final List<Integer> children = new ArrayList<>();
        private final Map<Namespace, SortedSet<Integer>> ids = new EnumMap<>(Namespace.class);
        private final List<RawCard> passthrough = new ArrayList<>();

        FileBuilder(int index, Path path, int parentIndex) {
            this.index = index;
            this.path = path;
            this.parentIndex = parentIndex;
        }

        IncludeFileNode build() {
            return new IncludeFileNode(index, path, parentIndex, children, ids, passthrough);
        }
    }
}

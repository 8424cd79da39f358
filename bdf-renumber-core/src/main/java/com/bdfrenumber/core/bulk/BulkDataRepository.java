package com.bdfrenumber.core.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@link ModelRepository} backed by {@link DeckWalker} and {@link CardReader}.
 *
 * <p>A missing include is skipped with a log message. The include scanner
 * reports it as a structural error, which stops the run before the
 * incomplete model is renumbered.
 */
public class BulkDataRepository implements ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(BulkDataRepository.class);

    @Override
    public BulkModel read(Path root, Set<String> disabledCards) {
        BulkModel model = new BulkModel();
        ModelBuilder builder = new ModelBuilder(model, disabledCards);
        new DeckWalker(builder).walk(root);
        model.setControlDeck(builder.controlDeck());

        log.debug("Read {} cards ({} passthrough) from {} file(s) starting at {}",
            model.size(), model.passthrough().size(), builder.fileCount, root);
        return model;
    }

    private static final class ModelBuilder implements DeckVisitor {

        private final BulkModel model;
        private final Set<String> disabledCards;
        private final List<String> executiveLines = new ArrayList<>();
        private final List<String> caseControlLines = new ArrayList<>();
        private boolean sawControl;
        private int fileCount;

        ModelBuilder(BulkModel model, Set<String> disabledCards) {
            this.model = model;
            this.disabledCards = disabledCards;
        }

        @Override
        public void enterFile(Path file, Path parent) {
            fileCount++;
        }

        @Override
        public void missingInclude(Path file, Path parent) {
            log.warn("Include file not found: {} (referenced from {}); its cards are missing from the model",
                file, parent);
        }

        @Override
        public void controlLine(DeckSection section, String line) {
            sawControl = true;
            if (section == DeckSection.EXECUTIVE) {
                executiveLines.add(line);
            } else {
                caseControlLines.add(line);
            }
        }

        @Override
        public void beginBulk() {
            sawControl = true;
        }

        @Override
        public void card(Path file, RawCard card) {
            model.add(CardReader.read(card, disabledCards));
        }

        ControlDeck controlDeck() {
            return sawControl
                ? new ControlDeck(executiveLines, caseControlLines, false)
                : ControlDeck.bulkDataOnly();
        }
    }
}

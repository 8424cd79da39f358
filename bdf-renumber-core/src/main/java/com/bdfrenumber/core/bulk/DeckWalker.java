package com.bdfrenumber.core.bulk;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a deck file and its includes line by line, reporting sections, cards and includes.
 *
 * <p>The root file starts in executive control unless it contains neither
 * {@code CEND} nor {@code BEGIN BULK}, in which case it is bulk data only.
 * Include files always start in bulk data. {@code ENDDATA} ends a file.
 * A file included twice is walked once; the second statement is reported
 * as a duplicate, which also breaks include cycles.
 *
 * <p>Include statements are recognised in every section and always treated
 * as bulk data includes.
 */
public final class DeckWalker {

    private static final Logger log = LoggerFactory.getLogger(DeckWalker.class);

    static final Pattern INCLUDE_PATTERN = Pattern.compile(
        "^\\s*INCLUDE\\s+['\"]?(.+?)['\"]?\\s*$", Pattern.CASE_INSENSITIVE);

    private final DeckVisitor visitor;
    private final Set<Path> visited = new HashSet<>();

    public DeckWalker(DeckVisitor visitor) {
        this.visitor = visitor;
    }

    /**
     * Walks the root file and every file it includes.
     *
     * @param root root deck file
     * @throws RenumberException if the root is missing or a file cannot be read
     */
    public void walk(Path root) {
        Path file = normalize(root);
        if (!FileUtils.isRegularFile(file)) {
            throw new RenumberException("Input deck not found: " + root, root);
        }
        visited.clear();
        walkFile(file, null);
    }

    private void walkFile(Path file, Path parent) {
        visited.add(file);
        visitor.enterFile(file, parent);

        List<String> lines = read(file);
        DeckSection section = parent == null && hasControlSections(lines)
            ? DeckSection.EXECUTIVE
            : DeckSection.BULK;

        List<String> pending = new ArrayList<>();
        int pendingLine = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String upper = line.strip().toUpperCase(Locale.ROOT);

            Matcher include = INCLUDE_PATTERN.matcher(line);
            if (include.matches()) {
                pendingLine = flush(file, pending, pendingLine);
                followInclude(file, include.group(1));
                continue;
            }

            if (section != DeckSection.BULK && upper.startsWith("BEGIN") && upper.contains("BULK")) {
                section = DeckSection.BULK;
                visitor.beginBulk();
                continue;
            }

            switch (section) {
                case EXECUTIVE -> {
                    visitor.controlLine(DeckSection.EXECUTIVE, line);
                    if (upper.startsWith("CEND")) {
                        section = DeckSection.CASE_CONTROL;
                    }
                }
                case CASE_CONTROL -> visitor.controlLine(DeckSection.CASE_CONTROL, line);
                case BULK -> {
                    if (upper.startsWith("ENDDATA")) {
                        pendingLine = flush(file, pending, pendingLine);
                        visitor.exitFile(file);
                        return;
                    }
                    if (CardReader.isBlankOrComment(line)) {
                        continue;
                    }
                    if (CardReader.isContinuation(line)) {
                        if (pending.isEmpty()) {
                            log.debug("{}:{}: continuation line without a parent card ignored", file, i + 1);
                        } else {
                            pending.add(line);
                        }
                        continue;
                    }
                    flush(file, pending, pendingLine);
                    pending.add(line);
                    pendingLine = i + 1;
                }
            }
        }
        flush(file, pending, pendingLine);
        visitor.exitFile(file);
    }

    private void followInclude(Path file, String statementPath) {
        Path child = resolveInclude(statementPath, file.getParent());
        if (visited.contains(child)) {
            log.debug("Include {} already processed, skipping", child);
            visitor.duplicateInclude(child, file);
        } else if (!FileUtils.isRegularFile(child)) {
            log.warn("Include file not found: {} (referenced from {})", child, file);
            visitor.missingInclude(child, file);
        } else {
            walkFile(child, file);
        }
    }

    private int flush(Path file, List<String> pending, int pendingLine) {
        if (!pending.isEmpty()) {
            visitor.card(file, new RawCard(pending, pendingLine));
            pending.clear();
        }
        return 0;
    }

    private static boolean hasControlSections(List<String> lines) {
        for (String line : lines) {
            String upper = line.strip().toUpperCase(Locale.ROOT);
            if (upper.startsWith("CEND") || (upper.startsWith("BEGIN") && upper.contains("BULK"))) {
                return true;
            }
        }
        return false;
    }

    private static List<String> read(Path file) {
        try {
            return FileUtils.readLines(file);
        } catch (IOException e) {
            throw new RenumberException("Failed to read deck file: " + file, file, e);
        }
    }

    /**
     * Resolves an include path relative to the including file's directory.
     *
     * @param statementPath path as written in the include statement
     * @param baseDir directory of the including file
     * @return normalized absolute path
     */
    static Path resolveInclude(String statementPath, Path baseDir) {
        String cleaned = statementPath.strip();
        while (!cleaned.isEmpty() && (cleaned.startsWith("'") || cleaned.startsWith("\""))) {
            cleaned = cleaned.substring(1);
        }
        while (!cleaned.isEmpty() && (cleaned.endsWith("'") || cleaned.endsWith("\""))) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        Path path = Path.of(cleaned);
        return normalize(path.isAbsolute() ? path : baseDir.resolve(path));
    }

    static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}

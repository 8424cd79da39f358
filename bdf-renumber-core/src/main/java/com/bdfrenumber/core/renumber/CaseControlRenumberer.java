package com.bdfrenumber.core.renumber;

import com.bdfrenumber.core.card.Fields;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.IdMapSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites bulk data IDs referenced from case control entries such as {@code LOAD = 100}.
 *
 * <p>Only the integer value is replaced; indentation, options in parentheses
 * and trailing comments are kept. Entries that select case control sets or
 * output options are inert. Any other {@code NAME = integer} entry is left
 * unchanged and reported, because it may reference an ID this tool does not
 * know how to follow.
 *
 * <p>{@code SET n = ...} lists, continuation lines included, hold node or
 * element IDs. Like a {@code SET1} card, a list follows the namespace in
 * which most of its members are known. {@code THRU} ranges are rewritten as
 * ranges where the new IDs stay contiguous. Lists holding reals or other
 * keywords (frequencies, {@code ALL}) are not ID lists and stay as they are.
 */
public class CaseControlRenumberer {

    private static final Logger log = LoggerFactory.getLogger(CaseControlRenumberer.class);

    private static final Pattern ENTRY = Pattern.compile(
        "^\\s*([A-Za-z][A-Za-z0-9]*)\\s*(\\([^)]*\\))?\\s*=\\s*(\\d+)");
    private static final Pattern SET_HEADER = Pattern.compile("^\\s*SET\\s+\\d+\\s*=", Pattern.CASE_INSENSITIVE);
    private static final Pattern SET_ITEM = Pattern.compile(
        "(?<![\\w.])(\\d+)(?:\\s+THRU\\s+(\\d+)(?:\\s+BY\\s+(\\d+))?)?(?![\\w.])", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");
    private static final Pattern REAL = Pattern.compile("\\d\\.|\\.\\d|\\d[eE][+-]?\\d");
    private static final Set<String> SET_KEYWORDS = Set.of("THRU", "BY", "EXCEPT");
    private static final List<Namespace> SET_TARGETS = List.of(Namespace.NODE, Namespace.ELEMENT);

    /**
     * Entries whose value is a bulk data ID, with the namespace it lives in.
     */
    static final Map<String, Namespace> ENTRIES = Map.ofEntries(
        Map.entry("LOAD", Namespace.LOAD_SET),
        Map.entry("DLOAD", Namespace.LOAD_SET),
        Map.entry("DEFORM", Namespace.LOAD_SET),
        Map.entry("TEMPERATURE", Namespace.LOAD_SET),
        Map.entry("TEMP", Namespace.LOAD_SET),
        Map.entry("SPC", Namespace.CONSTRAINT_SET),
        Map.entry("SUPORT1", Namespace.CONSTRAINT_SET),
        Map.entry("MPC", Namespace.MPC_SET),
        Map.entry("METHOD", Namespace.METHOD),
        Map.entry("CMETHOD", Namespace.METHOD),
        Map.entry("SDAMP", Namespace.TABLE),
        Map.entry("BCSET", Namespace.CONTACT),
        Map.entry("BCONTACT", Namespace.CONTACT)
    );

    /**
     * Entries whose integer value is not an ID this tool renumbers.
     */
    static final Set<String> INERT = Set.of(
        "SUBCASE", "SUBCOM", "SUBSEQ", "SYM", "SYMCOM", "REPCASE",
        "TITLE", "SUBTITLE", "LABEL", "ECHO", "LINE", "MAXLINES", "ANALYSIS",
        "DISPLACEMENT", "DISP", "VELOCITY", "VELO", "ACCELERATION", "ACCE",
        "STRESS", "STRAIN", "FORCE", "ELFORCE", "SPCFORCES", "SPCF", "MPCFORCES", "MPCF",
        "OLOAD", "GPFORCE", "GPSTRESS", "ESE", "EKE", "EDE", "GPKE", "STRFIELD",
        "BOUTPUT", "BCRESULTS", "NOUTPUT", "FLUX", "THERMAL", "SACCELERATION", "SDISPLACEMENT",
        "SVELOCITY", "SVECTOR", "MEFFMASS", "WEIGHTCHECK", "GROUNDCHECK", "OUTPUT",
        "FREQ", "FREQUENCY", "TSTEP", "TSTEPNL", "NLPARM", "NLSTEP", "RESVEC",
        "MODES", "NSM", "K2GG", "M2GG", "B2GG", "P2G", "SEALL", "SUPER", "ADAPT", "AUTOSPC"
    );

    /**
     * Renumbers case control lines.
     *
     * @param lines case control lines
     * @param maps ID maps of the plan
     * @return rewritten lines and findings
     */
    public Result renumber(List<String> lines, IdMapSet maps) {
        List<String> rewritten = new ArrayList<>(lines.size());
        List<Finding> findings = new ArrayList<>();
        int changed = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!isComment(line) && SET_HEADER.matcher(line).find()) {
                int last = i;
                while (last + 1 < lines.size() && continues(lines.get(last))) {
                    last++;
                }
                List<String> set = lines.subList(i, last + 1);
                List<String> updated = rewriteSet(set, maps, findings);
                for (int j = 0; j < set.size(); j++) {
                    if (!updated.get(j).equals(set.get(j))) {
                        changed++;
                    }
                }
                rewritten.addAll(updated);
                i = last;
                continue;
            }
            String updated = rewriteLine(line, maps, findings);
            if (!updated.equals(line)) {
                changed++;
            }
            rewritten.add(updated);
        }

        log.debug("Case control: {} of {} line(s) changed", changed, lines.size());
        return new Result(rewritten, new ValidationReport(findings));
    }

    private static boolean isComment(String line) {
        return line.strip().startsWith("$");
    }

    private static boolean continues(String line) {
        return body(line).strip().endsWith(",");
    }

    private static String body(String line) {
        int comment = line.indexOf('$');
        return comment < 0 ? line : line.substring(0, comment);
    }

    private List<String> rewriteSet(List<String> set, IdMapSet maps, List<Finding> findings) {
        Matcher header = SET_HEADER.matcher(set.get(0));
        header.find();
        String title = set.get(0).substring(0, header.end() - 1).strip();
        List<String> bodies = new ArrayList<>();
        for (int i = 0; i < set.size(); i++) {
            String body = body(set.get(i));
            bodies.add(i == 0 ? body.substring(header.end()) : body);
        }
        if (!isIdList(bodies)) {
            return set;
        }

        List<Fields.IdSpan> items = new ArrayList<>();
        for (String body : bodies) {
            Matcher item = SET_ITEM.matcher(body);
            while (item.find()) {
                Fields.IdSpan span = span(item);
                if (span != null) {
                    items.add(span);
                }
            }
        }
        Namespace target = pickTarget(items, maps);
        if (target == null) {
            findings.add(Finding.warning(FindingCategory.UNRECOGNIZED_ENTRY,
                "Case control " + title + " lists no node or element ID known to the plan; not renumbered"));
            return set;
        }

        int unmapped = 0;
        List<String> rewritten = new ArrayList<>();
        for (int i = 0; i < set.size(); i++) {
            String line = set.get(i);
            int from = i == 0 ? header.end() : 0;
            int to = body(line).length();
            Matcher item = SET_ITEM.matcher(line).region(from, to);
            StringBuilder out = new StringBuilder();
            while (item.find()) {
                String replacement = rewriteItem(item, target, maps);
                if (replacement == null) {
                    unmapped++;
                    replacement = item.group();
                }
                item.appendReplacement(out, Matcher.quoteReplacement(replacement));
            }
            item.appendTail(out);
            rewritten.add(out.toString());
        }
        if (unmapped > 0) {
            findings.add(Finding.warning(FindingCategory.DANGLING_REFERENCE,
                "Case control " + title + ": " + unmapped + " item(s) not in the " + target.label()
                    + " maps were left unchanged").at(null, target, null));
        }
        return rewritten;
    }

    private static boolean isIdList(List<String> bodies) {
        for (String body : bodies) {
            if (REAL.matcher(body).find()) {
                return false;
            }
            Matcher word = WORD.matcher(body);
            while (word.find()) {
                if (!SET_KEYWORDS.contains(word.group().toUpperCase(Locale.ROOT))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Fields.IdSpan span(Matcher item) {
        int low = Fields.parseId(item.group(1));
        int high = item.group(2) == null ? low : Fields.parseId(item.group(2));
        int step = item.group(3) == null ? 1 : Fields.parseId(item.group(3));
        if (low < 0 || high < low || step < 0) {
            return null;
        }
        return new Fields.IdSpan(0, item.group(2) == null ? 0 : 1, low, high, step);
    }

    private static Namespace pickTarget(List<Fields.IdSpan> items, IdMapSet maps) {
        Namespace best = null;
        long bestScore = 0;
        for (Namespace candidate : SET_TARGETS) {
            long score = items.stream().mapToLong(span -> span.membersIn(maps.mappedIds(candidate)).count()).sum();
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private static String rewriteItem(Matcher item, Namespace target, IdMapSet maps) {
        Fields.IdSpan span = span(item);
        if (span == null) {
            return null;
        }
        List<Integer> newIds = span.membersIn(maps.mappedIds(target))
            .map(oldId -> maps.lookup(target, oldId))
            .toList();
        if (newIds.isEmpty()) {
            return null;
        }
        if (item.group(2) == null) {
            return String.valueOf(newIds.get(0));
        }
        List<String> fields = RecordRenumberer.compress(newIds);
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            String field = fields.get(i);
            if ("THRU".equals(field)) {
                joined.append(" THRU ");
            } else {
                if (i > 0 && !"THRU".equals(fields.get(i - 1))) {
                    joined.append(", ");
                }
                joined.append(field);
            }
        }
        return joined.toString();
    }

    private String rewriteLine(String line, IdMapSet maps, List<Finding> findings) {
        if (isComment(line)) {
            return line;
        }
        Matcher matcher = ENTRY.matcher(line);
        if (!matcher.find()) {
            return line;
        }
        String keyword = matcher.group(1).toUpperCase(Locale.ROOT);
        Namespace namespace = ENTRIES.get(keyword);
        if (namespace == null) {
            if (!INERT.contains(keyword)) {
                findings.add(Finding.warning(FindingCategory.UNRECOGNIZED_ENTRY,
                    "Case control entry '" + line.strip() + "' is not renumbered"));
            }
            return line;
        }

        int oldId = Fields.parseId(matcher.group(3));
        if (oldId < 0) {
            return line;
        }
        int newId = maps.lookup(namespace, oldId);
        if (newId < 0) {
            findings.add(Finding.warning(FindingCategory.DANGLING_REFERENCE,
                "Case control entry '" + line.strip() + "' references " + namespace.label() + " "
                    + oldId + ", which no file defines").at(null, namespace, oldId));
            return line;
        }
        return line.substring(0, matcher.start(3)) + newId + line.substring(matcher.end(3));
    }

    /**
     * Rewritten case control and the findings raised on the way.
     *
     * @param lines case control lines after renumbering
     * @param report unrecognized entries and undefined IDs
     */
    public record Result(List<String> lines, ValidationReport report) {

        /**
         * Compact constructor with validation.
         */
        public Result {
            lines = List.copyOf(lines);
        }
    }
}

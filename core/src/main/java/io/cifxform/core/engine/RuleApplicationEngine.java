package io.cifxform.core.engine;

import io.cifxform.core.format.DataNames;
import io.cifxform.core.format.TextBlockTracker;
import io.cifxform.core.format.ValueFormatter;
import io.cifxform.core.model.ApplyResult;
import io.cifxform.core.model.CheckFinding;
import io.cifxform.core.model.FieldRule;
import io.cifxform.core.model.RuleSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RuleSet} to CIF text.
 *
 * <p>Every entry point takes the document as a string and returns an {@link ApplyResult} holding
 * a new string plus one log entry per change; the input and the rule set are never modified.
 * DELETE and EDIT match every line whose content starts with the field name, so {@code _a} also
 * hits {@code _ab}. RENAME, and the field lookups of APPEND, CALCULATE and CHECK, match tokens:
 * the name must be followed by whitespace or the end of the line. Lines inside semicolon text
 * blocks are never matched.
 *
 * <p>Running the same rules twice is safe: once renamed, edited or deleted, there is nothing left
 * for the second pass to match, and it logs nothing.
 *
 * <p>Stateless and thread-safe.
 */
public final class RuleApplicationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleApplicationEngine.class);

    /** Separator written between a data name and a value set by EDIT or CALCULATE. */
    static final String VALUE_SEPARATOR = "    ";

    /** A numeric CIF value with an optional standard uncertainty, e.g. {@code 1.234(5)}. */
    private static final Pattern NUMERIC_VALUE =
            Pattern.compile("^([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)(?:\\(\\d+\\))?$");

    private final boolean preferTripleQuotes;

    public RuleApplicationEngine() {
        this(false);
    }

    /** @param preferTripleQuotes how {@link #addMissing} encodes multiline default values */
    public RuleApplicationEngine(boolean preferTripleQuotes) {
        this.preferTripleQuotes = preferTripleQuotes;
    }

    /** Runs DELETE/EDIT/RENAME, then APPEND, then CALCULATE. */
    public ApplyResult process(String content, RuleSet rules) {
        ApplyResult applied = apply(content, rules);
        ApplyResult appended = applied.then(append(applied.content(), rules));
        return appended.then(calculate(appended.content(), rules));
    }

    // ── DELETE / EDIT / RENAME ──

    /**
     * Applies the DELETE, EDIT and RENAME rules, in rule order. Other rule types are ignored.
     *
     * @return the rewritten text and the operation log
     */
    public ApplyResult apply(String content, RuleSet rules) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        List<String> lines = split(content);
        List<String> log = new ArrayList<>();
        for (FieldRule rule : rules.rules()) {
            if (rule instanceof FieldRule.Delete d) {
                if (removeField(lines, d.name())) {
                    record(log, "DELETED: " + d.name());
                }
            } else if (rule instanceof FieldRule.Edit e) {
                edit(lines, e, log);
            } else if (rule instanceof FieldRule.Rename r) {
                if (rename(lines, r.name(), r.target())) {
                    record(log, "RENAMED: " + r.name() + " -> " + r.target());
                }
            }
        }
        return new ApplyResult(String.join("\n", lines), log);
    }

    private static void edit(List<String> lines, FieldRule.Edit rule, List<String> log) {
        if (rule.value().isEmpty()) {
            if (removeField(lines, rule.name())) {
                record(log, "DELETED: " + rule.name());
            }
            return;
        }
        String replacement = rule.name() + VALUE_SEPARATOR + rule.value();
        boolean changed = false;
        TextBlockTracker tracker = new TextBlockTracker();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT
                    || !DataNames.startsWithPrefix(line, rule.name())) {
                continue;
            }
            if (!line.equals(replacement)) {
                lines.set(i, replacement);
                changed = true;
            }
            // The old value may have been a text block on the following lines.
            if (removeBlockAfter(lines, i)) {
                changed = true;
            }
        }
        if (changed) {
            record(log, "EDITED: " + rule.name() + " -> " + rule.value());
        }
    }

    /** Removes every line starting with {@code name}, together with a text block that follows it. */
    private static boolean removeField(List<String> lines, String name) {
        boolean removed = false;
        TextBlockTracker tracker = new TextBlockTracker();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (tracker.advance(line) == TextBlockTracker.LineKind.CONTENT && DataNames.startsWithPrefix(line, name)) {
                removeBlockAfter(lines, i);
                lines.remove(i);
                removed = true;
            } else {
                i++;
            }
        }
        return removed;
    }

    /** Removes the text block that starts on the line after {@code index}, if there is one. */
    private static boolean removeBlockAfter(List<String> lines, int index) {
        int open = index + 1;
        if (open >= lines.size() || !TextBlockTracker.isDelimiter(lines.get(open))) {
            return false;
        }
        int close = open + 1;
        while (close < lines.size() && !TextBlockTracker.isDelimiter(lines.get(close))) {
            close++;
        }
        int end = Math.min(close, lines.size() - 1);
        lines.subList(open, end + 1).clear();
        return true;
    }

    private static boolean rename(List<String> lines, String oldName, String newName) {
        boolean renamed = false;
        TextBlockTracker tracker = new TextBlockTracker();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT
                    || !DataNames.startsWithToken(line, oldName)) {
                continue;
            }
            int nameStart = line.length() - line.stripLeading().length();
            lines.set(i, line.substring(0, nameStart) + newName + line.substring(nameStart + oldName.length()));
            renamed = true;
        }
        return renamed;
    }

    // ── APPEND ──

    /**
     * Applies the APPEND rules: for a field whose value is a semicolon text block, a blank line and
     * the rule's text are inserted before the closing {@code ;}. Fields that are not text blocks
     * are left alone.
     */
    public ApplyResult append(String content, RuleSet rules) {
        Objects.requireNonNull(content, "content must not be null");
        List<String> lines = split(content);
        List<String> log = new ArrayList<>();
        for (FieldRule.Append rule : rules.rulesOfType(FieldRule.Append.class)) {
            if (appendToBlock(lines, rule)) {
                record(log, "APPENDED: " + rule.name());
            } else {
                LOG.debug("APPEND skipped for {}: no text block value", rule.name());
            }
        }
        return new ApplyResult(String.join("\n", lines), log);
    }

    private static boolean appendToBlock(List<String> lines, FieldRule.Append rule) {
        TextBlockTracker tracker = new TextBlockTracker();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT
                    || !DataNames.startsWithToken(line, rule.name())) {
                continue;
            }
            if (i + 1 >= lines.size() || !TextBlockTracker.isLoneDelimiter(lines.get(i + 1))) {
                continue;
            }
            int close = i + 2;
            while (close < lines.size() && !TextBlockTracker.isLoneDelimiter(lines.get(close))) {
                close++;
            }
            if (close >= lines.size()) {
                return false;
            }
            List<String> insert = new ArrayList<>();
            insert.add("");
            insert.addAll(Arrays.asList(rule.text().split("\n", -1)));
            lines.addAll(close, insert);
            return true;
        }
        return false;
    }

    // ── CALCULATE ──

    /**
     * Applies the CALCULATE rules in order. Each expression sees the numeric single-line fields of
     * the document plus the results of earlier CALCULATE rules. A result overwrites the field's
     * line, or is appended when the field is absent. A failed evaluation changes nothing.
     */
    public ApplyResult calculate(String content, RuleSet rules) {
        Objects.requireNonNull(content, "content must not be null");
        List<FieldRule.Calculate> calculations = rules.rulesOfType(FieldRule.Calculate.class);
        if (calculations.isEmpty()) {
            return ApplyResult.unchanged(content);
        }
        List<String> lines = split(content);
        Map<String, Double> fields = numericFields(lines);
        List<String> log = new ArrayList<>();
        for (FieldRule.Calculate rule : calculations) {
            EvaluationResult result = ExpressionEvaluator.evaluate(rule.expression(), fields, rule.name());
            if (!result.isSuccess()) {
                LOG.warn("CALCULATE {} = {} failed: {}", rule.name(), rule.expression(), result.error());
                log.add("CALCULATE FAILED: " + rule.name() + ": " + result.error());
                continue;
            }
            double value = result.value().getAsDouble();
            String formatted = ExpressionEvaluator.formatNumber(value);
            fields.put(rule.name(), value);
            setField(lines, rule.name(), formatted);
            record(log, "CALCULATED: " + rule.name() + " = " + formatted);
        }
        return new ApplyResult(String.join("\n", lines), log);
    }

    /**
     * Numeric values of single-line fields outside text blocks; uncertainties are dropped, and so
     * are numbers too large for a double.
     */
    static Map<String, Double> numericFields(List<String> lines) {
        Map<String, Double> fields = new LinkedHashMap<>();
        TextBlockTracker tracker = new TextBlockTracker();
        for (String line : lines) {
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT) {
                continue;
            }
            Matcher m = DataNames.DATA_LINE.matcher(line);
            if (!m.matches() || m.group(4) == null) {
                continue;
            }
            Matcher number = NUMERIC_VALUE.matcher(m.group(4).strip());
            if (number.matches()) {
                double value = Double.parseDouble(number.group(1));
                if (Double.isFinite(value)) {
                    fields.put(m.group(2), value);
                }
            }
        }
        return fields;
    }

    private static void setField(List<String> lines, String name, String value) {
        String replacement = name + VALUE_SEPARATOR + value;
        boolean found = false;
        TextBlockTracker tracker = new TextBlockTracker();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (tracker.advance(line) == TextBlockTracker.LineKind.CONTENT && DataNames.startsWithToken(line, name)) {
                lines.set(i, replacement);
                found = true;
            }
        }
        if (!found) {
            appendLine(lines, replacement);
        }
    }

    // ── CHECK ──

    /** Reports, for each CHECK rule, whether the field is present and what value it has. */
    public List<CheckFinding> check(String content, RuleSet rules) {
        Objects.requireNonNull(content, "content must not be null");
        List<String> lines = split(content);
        List<CheckFinding> findings = new ArrayList<>();
        for (FieldRule.Check rule : rules.rulesOfType(FieldRule.Check.class)) {
            boolean present = false;
            String current = null;
            TextBlockTracker tracker = new TextBlockTracker();
            for (String line : lines) {
                if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT
                        || !DataNames.startsWithToken(line, rule.name())) {
                    continue;
                }
                present = true;
                Matcher m = DataNames.DATA_LINE.matcher(line);
                if (m.matches() && m.group(4) != null && !m.group(4).isBlank()) {
                    current = unquote(m.group(4).strip());
                }
                break;
            }
            findings.add(new CheckFinding(
                    rule.name(), present, current, rule.defaultValue(), rule.suggestions(), rule.description()));
        }
        return findings;
    }

    /**
     * Appends every CHECK field the document lacks, with its default value encoded for CIF2 (or
     * {@code ?} when the rule has no default).
     */
    public ApplyResult addMissing(String content, RuleSet rules) {
        List<String> lines = split(content);
        List<String> log = new ArrayList<>();
        for (CheckFinding finding : check(content, rules)) {
            if (finding.present()) {
                continue;
            }
            String value = finding.defaultValue().isEmpty()
                    ? "?"
                    : ValueFormatter.format(finding.defaultValue(), preferTripleQuotes);
            boolean ownLines = value.indexOf('\n') >= 0;
            appendLine(lines, ownLines ? finding.field() + "\n" + value : finding.field() + " " + value);
            record(log, "ADDED: " + finding.field() + " " + value);
        }
        return new ApplyResult(String.join("\n", lines), log);
    }

    // ── Helpers ──

    private static List<String> split(String content) {
        return new ArrayList<>(Arrays.asList(content.split("\n", -1)));
    }

    /** Adds a line at the end, keeping a trailing newline if the text had one. */
    private static void appendLine(List<String> lines, String line) {
        if (lines.size() == 1 && lines.get(0).isEmpty()) {
            lines.set(0, line);
            lines.add("");
        } else if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.add(lines.size() - 1, line);
        } else {
            lines.add(line);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '\'' || first == '"') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static void record(List<String> log, String entry) {
        LOG.debug("{}", entry);
        log.add(entry);
    }
}

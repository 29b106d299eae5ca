package io.cifxform.core.engine;

import io.cifxform.core.format.DataNames;
import io.cifxform.core.format.FormatAnalyzer;
import io.cifxform.core.format.TextBlockTracker;
import io.cifxform.core.model.ConversionResult;
import io.cifxform.core.spi.FieldDictionary;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites data names between the CIF1 and CIF2 dialects using a {@link FieldDictionary}.
 *
 * <p>Only data names at the start of a line are rewritten: single-line fields and loop headers.
 * Loop data rows, semicolon text blocks and comments are copied unchanged, as is the whitespace
 * between a name and its value. Names the dictionary cannot map are kept and reported.
 */
public final class FormatConverter {

    private static final Logger LOG = LoggerFactory.getLogger(FormatConverter.class);

    private final FieldDictionary dictionary;

    public FormatConverter(FieldDictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary must not be null");
    }

    /**
     * Converts to CIF2: adds the {@code #\#CIF_2.0} header when missing, maps each name to its CIF2
     * form (deprecated names go to their replacement when one exists), then drops repeated fields
     * that now share a name within one data block.
     */
    public ConversionResult convertToCif2(String content) {
        Objects.requireNonNull(content, "content must not be null");
        List<String> changes = new ArrayList<>();
        List<String> out = new ArrayList<>();
        int offset = 0;
        if (!FormatAnalyzer.hasCif2Header(content)) {
            out.add(FormatAnalyzer.CIF2_HEADER);
            out.add("");
            offset = 2;
            changes.add("Added CIF2 version header");
        }
        Set<String> unknown = new LinkedHashSet<>();
        String[] lines = content.split("\n", -1);
        rewriteNames(lines, this::toCif2Name, unknown, changes, offset);
        for (String line : lines) {
            out.add(line);
        }
        removeDuplicates(out, changes);
        return finish(String.join("\n", out), changes, unknown);
    }

    /** Converts to CIF1: removes the CIF2 header and maps each name to its preferred CIF1 alias. */
    public ConversionResult convertToCif1(String content) {
        Objects.requireNonNull(content, "content must not be null");
        List<String> changes = new ArrayList<>();
        Set<String> unknown = new LinkedHashSet<>();
        String[] lines = content.split("\n", -1);
        rewriteNames(lines, this::toCif1Name, unknown, changes, 0);
        List<String> out = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].strip().startsWith(FormatAnalyzer.CIF2_HEADER)) {
                changes.add("Line " + (i + 1) + ": Removed CIF2 version header");
                continue;
            }
            out.add(lines[i]);
        }
        return finish(String.join("\n", out), changes, unknown);
    }

    /** The CIF2 form of a name, or the name itself if the dictionary has none. */
    public String toCif2Name(String name) {
        if (dictionary.isFieldDeprecated(name)) {
            Optional<String> replacement = dictionary.getReplacementField(name);
            if (replacement.isPresent() && !replacement.get().equalsIgnoreCase(name)) {
                return replacement.get();
            }
        }
        return dictionary.getCif2Equivalent(name).orElse(name);
    }

    /** The CIF1 form of a name, or the name itself if the dictionary has none. */
    public String toCif1Name(String name) {
        return dictionary.getCif1Equivalent(name).orElse(name);
    }

    private void rewriteNames(
            String[] lines, UnaryOperator<String> mapping, Set<String> unknown, List<String> changes, int offset) {
        TextBlockTracker blocks = new TextBlockTracker();
        LoopState loop = new LoopState();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (blocks.advance(line) != TextBlockTracker.LineKind.CONTENT) {
                continue;
            }
            if (!loop.isHeaderOrField(line)) {
                continue;
            }
            Matcher m = DataNames.DATA_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String name = m.group(2);
            if (!dictionary.isKnownField(name)) {
                unknown.add(name);
            }
            String converted = mapping.apply(name);
            if (converted.equals(name)) {
                continue;
            }
            String rewritten = m.group(1) + converted + (m.group(3) != null ? m.group(3) + m.group(4) : "");
            lines[i] = rewritten;
            changes.add("Line " + (i + 1 + offset) + ": " + line.strip() + " -> " + rewritten.strip());
        }
    }

    /** Keeps the first single-line occurrence of each name per data block. */
    private static void removeDuplicates(List<String> lines, List<String> changes) {
        Map<String, String> seen = new HashMap<>();
        TextBlockTracker blocks = new TextBlockTracker();
        LoopState loop = new LoopState();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (blocks.advance(line) != TextBlockTracker.LineKind.CONTENT) {
                i++;
                continue;
            }
            String stripped = line.strip();
            if (stripped.toLowerCase(Locale.ROOT).startsWith("data_")) {
                seen.clear();
            }
            Matcher m = DataNames.DATA_LINE.matcher(line);
            if (loop.isHeaderOrField(line) && !loop.inLoop() && m.matches() && m.group(4) != null && !m.group(4).isBlank()) {
                String key = m.group(2).toLowerCase(Locale.ROOT);
                if (seen.containsKey(key)) {
                    lines.remove(i);
                    changes.add("Removed duplicate field " + m.group(2) + " (kept " + seen.get(key) + ")");
                    continue;
                }
                seen.put(key, m.group(2));
            }
            i++;
        }
    }

    private static ConversionResult finish(String content, List<String> changes, Set<String> unknown) {
        if (!unknown.isEmpty()) {
            changes.add("WARNING: " + unknown.size() + " unknown field(s): " + String.join(", ", unknown));
            LOG.warn("{} unknown field(s): {}", unknown.size(), unknown);
        }
        return new ConversionResult(content, changes, new ArrayList<>(unknown));
    }

    /**
     * Follows {@code loop_} tables line by line so that data rows are told apart from header
     * names. A loop ends at a blank line, a new {@code loop_} or {@code data_}, or a data name
     * after its rows.
     */
    static final class LoopState {

        private boolean inLoop;
        private boolean inRows;

        /** Advances past one content line; returns {@code true} if it holds a data name to consider. */
        boolean isHeaderOrField(String line) {
            String stripped = line.strip();
            String lower = stripped.toLowerCase(Locale.ROOT);
            if (lower.equals("loop_")) {
                inLoop = true;
                inRows = false;
                return false;
            }
            if (stripped.isEmpty() || lower.startsWith("data_")) {
                inLoop = false;
                inRows = false;
                return false;
            }
            if (stripped.startsWith("#")) {
                return false;
            }
            if (stripped.startsWith("_")) {
                if (inRows) {
                    inLoop = false;
                    inRows = false;
                }
                return true;
            }
            if (inLoop) {
                inRows = true;
            }
            return false;
        }

        boolean inLoop() {
            return inLoop;
        }
    }
}

package io.cifxform.core.rules;

import io.cifxform.core.error.RuleFileNotFoundException;
import io.cifxform.core.error.RuleParseException;
import io.cifxform.core.format.DataNames;
import io.cifxform.core.model.FieldRule;
import io.cifxform.core.model.RuleAction;
import io.cifxform.core.model.RuleSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses field-rules files into {@link RuleSet} instances.
 *
 * <p>File format, one rule per line:
 *
 * <pre>
 * # _field: description
 * _field value                   # CHECK (no prefix), value optional
 * CHECK: _field value
 * DELETE: _field
 * EDIT: _field new value
 * APPEND: _field text to append
 * RENAME: _old_field _new_field
 * CALCULATE: _field = _a / (_b * 60)
 * </pre>
 *
 * <p>{@code #} starts a trailing comment; lines starting with {@code //} are comments too. The
 * file is read twice: the first pass collects descriptions from {@code # _field: text} lines and
 * trailing comments, the second builds rules. Repeated CHECK lines for one field merge into a
 * single rule that accumulates distinct values as suggestions; repeated APPEND lines concatenate
 * their text with a blank line between. A malformed line is logged and skipped.
 *
 * <p>Thread-safe: holds no state between calls.
 */
public final class RuleDefinitionLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleDefinitionLoader.class);

    private static final Pattern ACTION_PREFIX =
            Pattern.compile("^(DELETE|EDIT|APPEND|RENAME|CALCULATE|CHECK)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    private static final String OPTIONS_MARKER = "options:";

    private static final String APPEND_SEPARATOR = "\n\n";

    /**
     * Loads the rules file at the given path (UTF-8).
     *
     * @throws RuleFileNotFoundException if the file cannot be read
     */
    public RuleSet load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuleFileNotFoundException("Cannot read rules file: " + e.getMessage(), e, path.toString());
        }
        return load(text, path.toString());
    }

    /** Loads rules from text with no source label. */
    public RuleSet load(String text) {
        return load(text, null);
    }

    /**
     * Loads rules from text.
     *
     * @param text the rules file content
     * @param source label for log messages, may be null
     * @return rules in first-seen order
     */
    public RuleSet load(String text, String source) {
        Objects.requireNonNull(text, "text must not be null");
        String label = source != null ? source : "<inline>";
        String[] lines = text.split("\\r?\n", -1);

        Map<String, String> descriptions = collectDescriptions(lines);

        List<Slot> slots = new ArrayList<>();
        Map<String, Slot> aggregated = new HashMap<>();
        int skipped = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }
            int hash = line.indexOf('#');
            if (hash >= 0) {
                line = line.substring(0, hash).strip();
            }
            if (line.isEmpty()) {
                continue;
            }
            try {
                ParsedLine parsed = parseLine(line, label, i + 1);
                String description = formatDescription(descriptions.getOrDefault(parsed.field(), ""));
                addRule(parsed, description, slots, aggregated);
            } catch (RuleParseException e) {
                skipped++;
                LOG.warn("Skipping rule line {} in {}: {}", e.lineNumber(), label, e.getMessage());
            }
        }

        List<FieldRule> rules = slots.stream().map(Slot::build).toList();
        LOG.info("Loaded {} rule(s) from {} ({} line(s) skipped)", rules.size(), label, skipped);
        return new RuleSet(rules, source);
    }

    // ── Pass 1: descriptions ──

    private static Map<String, String> collectDescriptions(String[] lines) {
        Map<String, String> descriptions = new HashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.startsWith("#")) {
                String[] parts = line.substring(1).strip().split(":", 2);
                if (parts.length == 2 && parts[0].strip().startsWith("_")) {
                    descriptions.put(parts[0].strip(), parts[1].strip());
                }
            } else if (line.indexOf('#') >= 0 && !line.startsWith("//")) {
                int hash = line.indexOf('#');
                String valuePart = stripActionPrefix(line.substring(0, hash).strip());
                if (valuePart.startsWith("_")) {
                    String field = valuePart.split("\\s+", 2)[0];
                    descriptions.put(field, line.substring(hash + 1).strip());
                }
            }
        }
        return descriptions;
    }

    private static String stripActionPrefix(String line) {
        Matcher m = ACTION_PREFIX.matcher(line);
        return m.find() ? line.substring(m.end()) : line;
    }

    /** Puts an {@code options:} list on its own line. */
    static String formatDescription(String description) {
        int idx = description.toLowerCase(Locale.ROOT).indexOf(OPTIONS_MARKER);
        if (idx < 0) {
            return description;
        }
        return description.substring(0, idx).strip() + "\n" + description.substring(idx).strip();
    }

    // ── Pass 2: rules ──

    private record ParsedLine(RuleAction action, String field, String value) {}

    private static ParsedLine parseLine(String line, String source, int lineNumber) {
        RuleAction action = RuleAction.CHECK;
        String rest = line;
        Matcher m = ACTION_PREFIX.matcher(line);
        if (m.find()) {
            action = RuleAction.fromKeyword(m.group(1)).orElse(RuleAction.CHECK);
            rest = line.substring(m.end()).strip();
        }
        if (rest.isEmpty()) {
            throw new RuleParseException(action + " rule has no field name", source, lineNumber);
        }

        return switch (action) {
            case DELETE -> {
                if (rest.split("\\s+").length != 1) {
                    throw new RuleParseException("DELETE takes a field name only: " + rest, source, lineNumber);
                }
                yield new ParsedLine(action, requireFieldName(rest, source, lineNumber), "");
            }
            case RENAME -> {
                String[] parts = rest.split("\\s+");
                if (parts.length != 2) {
                    throw new RuleParseException(
                            "RENAME takes exactly two field names: " + rest, source, lineNumber);
                }
                requireFieldName(parts[0], source, lineNumber);
                requireFieldName(parts[1], source, lineNumber);
                yield new ParsedLine(action, parts[0], parts[1]);
            }
            case CALCULATE -> {
                int eq = rest.indexOf('=');
                if (eq < 0) {
                    throw new RuleParseException("CALCULATE needs '<field> = <expression>': " + rest, source, lineNumber);
                }
                String field = rest.substring(0, eq).strip();
                String expression = rest.substring(eq + 1).strip();
                if (field.isEmpty() || expression.isEmpty()) {
                    throw new RuleParseException(
                            "CALCULATE field and expression must not be empty: " + rest, source, lineNumber);
                }
                yield new ParsedLine(action, requireFieldName(field, source, lineNumber), expression);
            }
            case CHECK, EDIT, APPEND -> {
                String[] parts = rest.split("\\s+", 2);
                String field = requireFieldName(parts[0], source, lineNumber);
                String value = parts.length == 2 ? parts[1].strip() : "";
                if (action == RuleAction.APPEND && value.isEmpty()) {
                    throw new RuleParseException("APPEND has no text for " + field, source, lineNumber);
                }
                yield new ParsedLine(action, field, value);
            }
        };
    }

    private static String requireFieldName(String token, String source, int lineNumber) {
        if (!DataNames.isDataName(token) || token.chars().anyMatch(Character::isWhitespace)) {
            throw new RuleParseException("Not a field name: '" + token + "'", source, lineNumber);
        }
        return token;
    }

    private static void addRule(ParsedLine parsed, String description, List<Slot> slots, Map<String, Slot> aggregated) {
        switch (parsed.action()) {
            case CHECK, APPEND -> {
                String key = parsed.action() + " " + parsed.field();
                Slot slot = aggregated.get(key);
                if (slot == null) {
                    slot = new Slot(parsed.action(), parsed.field());
                    aggregated.put(key, slot);
                    slots.add(slot);
                }
                slot.merge(parsed.value(), description);
            }
            default -> {
                Slot slot = new Slot(parsed.action(), parsed.field());
                slot.merge(parsed.value(), description);
                slots.add(slot);
            }
        }
    }

    /** Mutable accumulator for one output rule; turned into an immutable {@link FieldRule} at the end. */
    private static final class Slot {

        private final RuleAction action;
        private final String field;
        private final Set<String> values = new LinkedHashSet<>();
        private final StringBuilder appended = new StringBuilder();
        private String value = "";
        private String defaultValue = "";
        private String description = "";

        Slot(RuleAction action, String field) {
            this.action = action;
            this.field = field;
        }

        void merge(String newValue, String newDescription) {
            if (description.isEmpty() && !newDescription.isEmpty()) {
                description = newDescription;
            }
            switch (action) {
                case CHECK -> {
                    if (!newValue.isEmpty()) {
                        values.add(newValue);
                        if (defaultValue.isEmpty()) {
                            defaultValue = newValue;
                        }
                    }
                }
                case APPEND -> {
                    if (appended.length() > 0) {
                        appended.append(APPEND_SEPARATOR);
                    }
                    appended.append(newValue);
                }
                default -> value = newValue;
            }
        }

        FieldRule build() {
            return switch (action) {
                case CHECK -> new FieldRule.Check(field, defaultValue, description, List.copyOf(values));
                case DELETE -> new FieldRule.Delete(field, description);
                case EDIT -> new FieldRule.Edit(field, value, description);
                case APPEND -> new FieldRule.Append(field, appended.toString(), description);
                case RENAME -> new FieldRule.Rename(field, value, description);
                case CALCULATE -> new FieldRule.Calculate(field, value, description);
            };
        }
    }
}

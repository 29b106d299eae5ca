package io.cifxform.core.dictionary;

import io.cifxform.core.model.DeprecationInfo;
import io.cifxform.core.model.DeprecationInfo.Severity;
import io.cifxform.core.model.DictionaryEntry;
import io.cifxform.core.model.FieldAlias;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deprecation status, replacement and migration advice for dictionary names.
 *
 * <p>A definition is deprecated when its block carries a {@code _definition_replaced} marker or
 * its description says so ({@code **DEPRECATED**}, {@code DEPRECATED.}, or a line starting with
 * {@code DEPRECATED}). Severity is {@link Severity#WARNING} with a replacement marker and {@link
 * Severity#INFO} when only the description says so. Aliases with an explicit deprecation date are
 * recorded separately, pointing at their enclosing definition; undated aliases are never
 * deprecated here.
 *
 * <p>Built once from the parser's entries on first use; lookups are case-insensitive.
 */
public final class DeprecationIndex {

    private static final Logger LOG = LoggerFactory.getLogger(DeprecationIndex.class);

    private static final Pattern DEPRECATED_MARKER =
            Pattern.compile("\\*\\*DEPRECATED\\*\\*|DEPRECATED\\.|^DEPRECATED", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
    private static final Pattern USE_FIELD = Pattern.compile("Use\\s+(_[\\w.\\-]*\\w)");
    private static final Pattern REPLACED_BY_FIELD = Pattern.compile("Replaced by\\s+'([^']+)'");

    private final DictionaryParser parser;
    private final Object lock = new Object();
    private volatile Map<String, DeprecationInfo> index;

    public DeprecationIndex(DictionaryParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /** Returns {@code true} if the name has a deprecation record. */
    public boolean isDeprecated(String name) {
        return getInfo(name).isPresent();
    }

    public Optional<DeprecationInfo> getInfo(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index().get(name.toLowerCase(Locale.ROOT)));
    }

    /** The replacement for a deprecated name, if one is named. */
    public Optional<String> getReplacement(String name) {
        return getInfo(name).map(DeprecationInfo::replacementField);
    }

    /**
     * Migration advice, e.g. {@code Replace '_a' with '_b' (deprecated since 2023-01-01)} or
     * {@code Field '_a' is deprecated: Deprecated field}.
     */
    public Optional<String> getMigrationSuggestion(String name) {
        return getInfo(name).map(info -> {
            if (info.replacementField() != null) {
                String suggestion = "Replace '" + name + "' with '" + info.replacementField() + "'";
                if (info.deprecationDate() != null) {
                    suggestion += " (deprecated since " + info.deprecationDate() + ")";
                }
                return suggestion;
            }
            String suggestion = "Field '" + name + "' is deprecated";
            if (info.reason() != null && !info.reason().isEmpty()) {
                suggestion += ": " + info.reason();
            }
            return suggestion;
        });
    }

    /** Every deprecated name, in dictionary order, as spelled in the dictionary. */
    public List<String> getAllDeprecatedFields() {
        return index().values().stream().map(DeprecationInfo::fieldName).toList();
    }

    /** Drops the cached index. Invalidate the parser as well to pick up a changed source. */
    public void invalidate() {
        synchronized (lock) {
            index = null;
        }
    }

    private Map<String, DeprecationInfo> index() {
        Map<String, DeprecationInfo> current = index;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (index == null) {
                index = build(parser);
            }
            return index;
        }
    }

    private static Map<String, DeprecationInfo> build(DictionaryParser parser) {
        Map<String, DeprecationInfo> result = new LinkedHashMap<>();
        for (DictionaryEntry entry : parser.entries()) {
            definitionInfo(entry).ifPresent(info -> result.put(key(entry.name()), info));
            for (FieldAlias alias : entry.aliases()) {
                if (alias.isDeprecated()) {
                    result.putIfAbsent(
                            key(alias.name()),
                            new DeprecationInfo(
                                    alias.name(),
                                    true,
                                    entry.name(),
                                    alias.deprecationDate(),
                                    "Superseded by " + entry.name(),
                                    Severity.WARNING));
                }
            }
        }
        LOG.info("Indexed {} deprecated names from {}", result.size(), parser.source().name());
        return Collections.unmodifiableMap(result);
    }

    /** The record for a definition itself, or empty if nothing marks it deprecated. */
    static Optional<DeprecationInfo> definitionInfo(DictionaryEntry entry) {
        String description = entry.description() != null ? entry.description() : "";
        boolean describedDeprecated = DEPRECATED_MARKER.matcher(description).find();
        if (!entry.replaced() && !describedDeprecated) {
            return Optional.empty();
        }

        String reason;
        if (describedDeprecated) {
            reason = reasonFromDescription(description);
        } else if (entry.replacementField() != null) {
            reason = "Superseded by " + entry.replacementField();
        } else {
            reason = "Deprecated with no direct replacement";
        }
        Severity severity = entry.replaced() ? Severity.WARNING : Severity.INFO;
        return Optional.of(new DeprecationInfo(entry.name(), true, entry.replacementField(), null, reason, severity));
    }

    private static String reasonFromDescription(String description) {
        Matcher use = USE_FIELD.matcher(description);
        if (use.find()) {
            return "Use " + use.group(1) + " instead";
        }
        Matcher replaced = REPLACED_BY_FIELD.matcher(description);
        if (replaced.find()) {
            return "Replaced by " + replaced.group(1);
        }
        return "Deprecated field";
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}

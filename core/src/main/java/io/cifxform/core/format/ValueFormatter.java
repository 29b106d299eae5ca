package io.cifxform.core.format;

import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes values for CIF2 output and decodes triple-quoted strings.
 *
 * <p>Encoding rules, first match wins:
 * <ol>
 * <li>{@code null} encodes to {@code ?}; the empty string to {@code ''}.
 * <li>The reserved values {@code .} and {@code ?} stay bare.
 * <li>Values containing a newline become a semicolon text block, or a triple-quoted string when
 * triple quotes are preferred and one of {@code '''} / {@code """} is absent from the value.
 * <li>Single-line values that need quoting get single quotes, else double quotes, else triple
 * quotes.
 * <li>Anything else is emitted verbatim.
 * </ol>
 *
 * <p>A single-line value holding both {@code '''} and {@code """}, or one triple sequence and a
 * trailing quote of the other kind, cannot be wrapped by any CIF2 quote. Such values are returned
 * verbatim and logged; {@link #isQuotable(String)} lets callers detect them first.
 *
 * <p>Stateless and thread-safe.
 */
public final class ValueFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(ValueFormatter.class);

    private static final String TRIPLE_SINGLE = "'''";
    private static final String TRIPLE_DOUBLE = "\"\"\"";

    /** Characters that delimit CIF2 lists and tables. */
    private static final String SPECIAL_CHARS = "[]{}";

    /** Characters that may not start a bare value. */
    private static final String RESERVED_LEADING = "_#$;'\"";

    private static final String[] RESERVED_PREFIXES = {"data_", "loop_", "save_", "global_", "stop_"};

    private ValueFormatter() {}

    /**
     * Encodes a value for CIF2 output.
     *
     * @param value the raw value, may be null
     * @param preferTripleQuotes use triple quotes instead of a semicolon block for multiline values
     * @return the encoded value
     */
    public static String format(String value, boolean preferTripleQuotes) {
        if (value == null) {
            return "?";
        }
        if (value.isEmpty()) {
            return "''";
        }
        if (".".equals(value) || "?".equals(value)) {
            return value;
        }
        if (isMultiline(value)) {
            return formatMultiline(value, preferTripleQuotes);
        }
        if (!needsQuoting(value)) {
            return value;
        }
        return quote(value).orElseGet(() -> {
            LOG.warn("Value cannot be wrapped in any CIF2 quote, emitting verbatim: {}", value);
            return value;
        });
    }

    /** Returns {@code true} if the value contains a newline. */
    public static boolean isMultiline(String value) {
        return value != null && value.indexOf('\n') >= 0;
    }

    /**
     * Returns {@code true} if a single-line value cannot be written bare.
     *
     * <p>That is the case for the empty string, and for values containing whitespace, a list/table
     * delimiter or a quote character, starting with one of {@code _ # $ ; ' "}, or starting with a
     * reserved word prefix such as {@code data_}.
     */
    public static boolean needsQuoting(String value) {
        if (value == null || value.isEmpty()) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || SPECIAL_CHARS.indexOf(c) >= 0 || c == '\'' || c == '"') {
                return true;
            }
        }
        if (RESERVED_LEADING.indexOf(value.charAt(0)) >= 0) {
            return true;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String prefix : RESERVED_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Returns {@code true} if the value contains any of {@code [ ] { }}. */
    public static boolean containsSpecialChars(String value) {
        if (value == null) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (SPECIAL_CHARS.indexOf(value.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code false} for values no CIF2 quote can wrap. A single-line value is quotable iff
     * {@link #quote(String)} finds a delimiter for it; a multiline value iff it lacks one of the
     * triple-quote sequences.
     */
    public static boolean isQuotable(String value) {
        if (value == null) {
            return true;
        }
        if (isMultiline(value)) {
            return !(value.contains(TRIPLE_SINGLE) && value.contains(TRIPLE_DOUBLE));
        }
        return quote(value).isPresent();
    }

    /**
     * Wraps a single-line value in the lightest quote style it allows.
     *
     * @return the quoted value, or empty if no delimiter fits
     */
    static Optional<String> quote(String value) {
        boolean hasSingle = value.indexOf('\'') >= 0;
        boolean hasDouble = value.indexOf('"') >= 0;
        if (!hasSingle) {
            return Optional.of("'" + value + "'");
        }
        if (!hasDouble) {
            return Optional.of('"' + value + '"');
        }
        // Triple quotes: the closing delimiter must not run into a trailing quote of the same kind.
        boolean singleFits = !value.contains(TRIPLE_SINGLE) && !value.endsWith("'");
        boolean doubleFits = !value.contains(TRIPLE_DOUBLE) && !value.endsWith("\"");
        if (singleFits) {
            return Optional.of(TRIPLE_SINGLE + value + TRIPLE_SINGLE);
        }
        if (doubleFits) {
            return Optional.of(TRIPLE_DOUBLE + value + TRIPLE_DOUBLE);
        }
        return Optional.empty();
    }

    /**
     * Encodes a multiline value as a semicolon text block, or as a triple-quoted string when
     * preferred and possible.
     */
    public static String formatMultiline(String value, boolean preferTripleQuotes) {
        if (preferTripleQuotes) {
            if (!value.contains(TRIPLE_SINGLE)) {
                return TRIPLE_SINGLE + "\n" + value + "\n" + TRIPLE_SINGLE;
            }
            if (!value.contains(TRIPLE_DOUBLE)) {
                return TRIPLE_DOUBLE + "\n" + value + "\n" + TRIPLE_DOUBLE;
            }
        }
        return ";\n" + value + "\n;";
    }

    /**
     * Decodes a triple-quoted string starting at {@code startPos}.
     *
     * <p>One leading and one trailing newline inside the delimiters are dropped.
     *
     * @param text the full text
     * @param startPos index of the first quote character
     * @return the content and the index just past the closing delimiter, or empty if {@code
     *     startPos} does not hold a triple quote or the string is unclosed
     */
    public static Optional<DecodedValue> decodeTripleQuoted(String text, int startPos) {
        if (text == null || startPos < 0 || startPos + 3 > text.length()) {
            return Optional.empty();
        }
        char quoteChar = text.charAt(startPos);
        if (quoteChar != '\'' && quoteChar != '"') {
            return Optional.empty();
        }
        String delimiter = String.valueOf(quoteChar).repeat(3);
        if (!text.startsWith(delimiter, startPos)) {
            return Optional.empty();
        }
        int contentStart = startPos + 3;
        int end = text.indexOf(delimiter, contentStart);
        if (end < 0) {
            return Optional.empty();
        }
        String content = text.substring(contentStart, end);
        if (content.startsWith("\n")) {
            content = content.substring(1);
        }
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        return Optional.of(new DecodedValue(content, end + 3));
    }

    /** Returns {@code true} if {@code text} holds {@code '''} or {@code """} at {@code pos}. */
    public static boolean isTripleQuoted(String text, int pos) {
        if (text == null || pos < 0 || pos + 3 > text.length()) {
            return false;
        }
        return text.startsWith(TRIPLE_SINGLE, pos) || text.startsWith(TRIPLE_DOUBLE, pos);
    }
}

package io.cifxform.core.dictionary;

import io.cifxform.core.format.DecodedValue;
import io.cifxform.core.format.ValueFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tokenises the body of a save block into tags, values and {@code loop_} keywords.
 *
 * <p>Recognises bare words, single- and double-quoted strings, triple-quoted strings, semicolon
 * text fields (a {@code ;} in column one up to the next one), bracketed CIF2 lists and tables kept
 * as raw text, and {@code #} comments.
 */
final class BlockTokenizer {

    enum Type {
        TAG,
        VALUE,
        LOOP
    }

    /** A token. {@code quoted} is set for delimited values, which are never tags or keywords. */
    record Token(Type type, String text, boolean quoted) {}

    private final String text;
    private int pos;

    private BlockTokenizer(String text) {
        this.text = text;
    }

    static List<Token> tokenize(String body) {
        return new BlockTokenizer(body).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                return tokens;
            }
            char c = text.charAt(pos);
            if (c == ';' && atLineStart()) {
                tokens.add(value(textField(), true));
            } else if (ValueFormatter.isTripleQuoted(text, pos)) {
                Optional<DecodedValue> decoded = ValueFormatter.decodeTripleQuoted(text, pos);
                if (decoded.isPresent()) {
                    pos = decoded.get().endPosition();
                    tokens.add(value(decoded.get().value(), true));
                } else {
                    tokens.add(bareToken());
                }
            } else if (c == '\'' || c == '"') {
                tokens.add(value(quoted(c), true));
            } else if (c == '[' || c == '{') {
                tokens.add(value(bracketed(), false));
            } else {
                tokens.add(bareToken());
            }
        }
    }

    private static Token value(String s, boolean quoted) {
        return new Token(Type.VALUE, s, quoted);
    }

    private Token bareToken() {
        int start = pos;
        while (pos < text.length() && !Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        String word = text.substring(start, pos);
        if (word.toLowerCase(Locale.ROOT).equals("loop_")) {
            return new Token(Type.LOOP, word, false);
        }
        if (word.startsWith("_")) {
            return new Token(Type.TAG, word, false);
        }
        return new Token(Type.VALUE, word, false);
    }

    /** Content between a column-one {@code ;} and the next column-one {@code ;}. */
    private String textField() {
        int start = pos + 1;
        int close = text.indexOf("\n;", start);
        String content;
        if (close < 0) {
            content = text.substring(start);
            pos = text.length();
        } else {
            content = text.substring(start, close);
            pos = close + 2;
        }
        return content.startsWith("\n") ? content.substring(1) : content;
    }

    /** A quoted string closes at a matching quote followed by whitespace or the end of text. */
    private String quoted(char quote) {
        int start = pos + 1;
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                break;
            }
            if (c == quote && (i + 1 >= text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                pos = i + 1;
                return text.substring(start, i);
            }
            i++;
        }
        // Unclosed: take the rest of the line.
        pos = i;
        return text.substring(start, i);
    }

    private String bracketed() {
        int start = pos;
        int depth = 0;
        char quote = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    pos++;
                    return text.substring(start, pos);
                }
            }
            pos++;
        }
        return text.substring(start);
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private boolean atLineStart() {
        return pos == 0 || text.charAt(pos - 1) == '\n';
    }
}

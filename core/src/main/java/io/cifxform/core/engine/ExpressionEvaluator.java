package io.cifxform.core.engine;

import io.cifxform.core.error.ExpressionEvalException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates restricted arithmetic expressions over numeric CIF field values.
 *
 * <p>Grammar:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('^' unary)?
 * primary    := number | '(' expression ')'
 * number     := digits ['.' digits] [('e' | 'E') ['+' | '-'] digits]
 * </pre>
 *
 * <p>{@code ^} is right-associative and binds tighter than unary minus, so {@code -2^2} is
 * {@code -4}. Field names are substituted textually before parsing, longest name first, and only
 * where the name is not followed by another name character. Any data name left after substitution
 * makes the evaluation fail: unknown fields are never treated as zero.
 *
 * <p>Failures (unresolved field, syntax error, division by zero, non-finite result) come back as
 * {@link EvaluationResult#failure(String)}; nothing is thrown to the caller.
 *
 * <p>Stateless and thread-safe.
 */
public final class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    /** A data-name token left in an expression after substitution. */
    private static final Pattern FIELD_TOKEN = Pattern.compile("_[A-Za-z0-9_.]*");

    private ExpressionEvaluator() {}

    /**
     * Evaluates an expression.
     *
     * @param expression the expression text, e.g. {@code _a / (_b * 60)}
     * @param fields known field values by data name
     * @return the value, or a failure with its reason
     */
    public static EvaluationResult evaluate(String expression, Map<String, Double> fields) {
        return evaluate(expression, fields, null);
    }

    /**
     * Evaluates an expression on behalf of a target field; the field name only appears in log and
     * error messages.
     */
    public static EvaluationResult evaluate(String expression, Map<String, Double> fields, String targetField) {
        try {
            if (expression == null || expression.isBlank()) {
                throw new ExpressionEvalException("Empty expression", targetField);
            }
            String substituted = substitute(expression, fields);
            Matcher unresolved = FIELD_TOKEN.matcher(substituted);
            if (unresolved.find()) {
                throw new ExpressionEvalException("Unresolved field reference: " + unresolved.group(), targetField);
            }
            double value = new Parser(substituted, targetField).parse();
            if (!Double.isFinite(value)) {
                throw new ExpressionEvalException("Result is not a finite number", targetField);
            }
            return EvaluationResult.success(value);
        } catch (ExpressionEvalException e) {
            LOG.debug("Expression '{}' failed: {}", expression, e.getMessage());
            return EvaluationResult.failure(e.getMessage());
        }
    }

    /** Formats a computed value for writing into a CIF document, e.g. {@code 1.0} or {@code 0.25}. */
    public static String formatNumber(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    /**
     * Replaces each known field name with its finite value, longest names first, on token
     * boundaries.
     */
    static String substitute(String expression, Map<String, Double> fields) {
        if (fields == null || fields.isEmpty()) {
            return expression;
        }
        List<String> names = new ArrayList<>(fields.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        String result = expression;
        for (String name : names) {
            Double value = fields.get(name);
            // Non-finite values have no literal form; the name stays and fails as unresolved.
            if (value == null || !Double.isFinite(value)) {
                continue;
            }
            Pattern p = Pattern.compile("(?<![A-Za-z0-9_.])" + Pattern.quote(name) + "(?![A-Za-z0-9_.])");
            String literal = BigDecimal.valueOf(value).toPlainString();
            if (value < 0) {
                literal = "(" + literal + ")";
            }
            result = p.matcher(result).replaceAll(Matcher.quoteReplacement(literal));
        }
        return result;
    }

    /** Recursive-descent parser that evaluates while it parses. */
    private static final class Parser {

        private final String text;
        private final String field;
        private int pos;

        Parser(String text, String field) {
            this.text = text;
            this.field = field;
        }

        double parse() {
            double value = expression();
            skipWhitespace();
            if (pos < text.length()) {
                throw error("Unexpected character '" + text.charAt(pos) + "' at position " + pos);
            }
            return value;
        }

        private double expression() {
            double value = term();
            while (true) {
                if (accept('+')) {
                    value += term();
                } else if (accept('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        private double term() {
            double value = unary();
            while (true) {
                if (accept('*')) {
                    value *= unary();
                } else if (accept('/')) {
                    double divisor = unary();
                    if (divisor == 0.0) {
                        throw error("Division by zero");
                    }
                    value /= divisor;
                } else {
                    return value;
                }
            }
        }

        private double unary() {
            if (accept('-')) {
                return -unary();
            }
            if (accept('+')) {
                return unary();
            }
            return power();
        }

        private double power() {
            double base = primary();
            if (accept('^')) {
                return Math.pow(base, unary());
            }
            return base;
        }

        private double primary() {
            skipWhitespace();
            if (accept('(')) {
                double value = expression();
                if (!accept(')')) {
                    throw error("Missing closing parenthesis");
                }
                return value;
            }
            return number();
        }

        private double number() {
            skipWhitespace();
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            if (pos < text.length() && text.charAt(pos) == '.') {
                pos++;
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
            if (pos == start || (pos == start + 1 && text.charAt(start) == '.')) {
                pos = start;
                throw error(pos < text.length()
                        ? "Unexpected character '" + text.charAt(pos) + "' at position " + pos
                        : "Unexpected end of expression");
            }
            if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                    pos++;
                }
                int digits = pos;
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
                if (pos == digits) {
                    pos = mark;
                    throw error("Malformed exponent at position " + mark);
                }
            }
            return Double.parseDouble(text.substring(start, pos));
        }

        private boolean accept(char c) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private ExpressionEvalException error(String message) {
            return new ExpressionEvalException(message, field);
        }
    }
}

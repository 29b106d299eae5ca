package io.cifxform.core.error;

/**
 * Thrown when a single line of a field-rules file cannot be turned into a rule. The loader catches
 * it, logs it and skips the line, so it never escapes {@code RuleDefinitionLoader.load}.
 */
public final class RuleParseException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public RuleParseException(String message, String source, int lineNumber) {
        super(message, source);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number of the offending rule line. */
    public int lineNumber() {
        return lineNumber;
    }
}

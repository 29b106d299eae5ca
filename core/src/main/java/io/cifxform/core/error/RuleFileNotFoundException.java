package io.cifxform.core.error;

/** Thrown when a field-rules file cannot be found or read. */
public final class RuleFileNotFoundException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    public RuleFileNotFoundException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

package io.cifxform.core.error;

/**
 * Abstract parent for load-time errors: reading a dictionary, a rules file or a bundled table.
 * Carries an additional {@code source} field identifying the file or resource that caused the
 * error.
 */
public abstract class CifLoadException extends CifXformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected CifLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected CifLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

package io.cifxform.core.error;

/** Thrown when the CIF2-only extension table cannot be read or has an invalid shape. */
public final class ExtensionTableException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    public ExtensionTableException(String message, String source) {
        super(message, source);
    }

    public ExtensionTableException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

package io.cifxform.core.error;

/**
 * Thrown when a dictionary file or classpath resource cannot be found or read. Callers must not
 * substitute an empty dictionary.
 */
public final class DictionaryNotFoundException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    public DictionaryNotFoundException(String message, String source) {
        super(message, source);
    }

    public DictionaryNotFoundException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

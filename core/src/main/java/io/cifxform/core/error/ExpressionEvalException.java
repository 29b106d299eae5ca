package io.cifxform.core.error;

/**
 * Thrown when an arithmetic expression cannot be evaluated: malformed syntax, an unresolved field
 * reference, division by zero or a non-finite result. URN: {@code
 * urn:cif-xform:error:expression-eval-failed}
 */
public final class ExpressionEvalException extends CifEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:cif-xform:error:expression-eval-failed";

    public ExpressionEvalException(String message, String field) {
        super(message, field);
    }

    public ExpressionEvalException(String message, Throwable cause, String field) {
        super(message, cause, field);
    }
}

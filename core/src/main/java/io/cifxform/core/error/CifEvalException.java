package io.cifxform.core.error;

/**
 * Abstract parent for evaluation errors raised while computing a field value. Carries the name of
 * the field being computed, or {@code null} when the expression is evaluated on its own.
 */
public abstract class CifEvalException extends CifXformException {

    private static final long serialVersionUID = 1L;

    private final String field;

    protected CifEvalException(String message, String field) {
        super(message, Phase.EVALUATION);
        this.field = field;
    }

    protected CifEvalException(String message, Throwable cause, String field) {
        super(message, cause, Phase.EVALUATION);
        this.field = field;
    }

    /** The field whose value was being computed, or {@code null}. */
    public String field() {
        return field;
    }
}

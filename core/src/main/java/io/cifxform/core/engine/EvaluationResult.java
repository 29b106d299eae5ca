package io.cifxform.core.engine;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of evaluating an arithmetic expression: either a value or the reason there is none.
 *
 * <p>Use the static factories {@link #success(double)} and {@link #failure(String)}.
 */
public final class EvaluationResult {

    private final Double value;
    private final String error;

    private EvaluationResult(Double value, String error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(double value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(String error) {
        return new EvaluationResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return value != null;
    }

    /** The value, or empty on failure. */
    public OptionalDouble value() {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /** The failure reason, or {@code null} on success. */
    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "EvaluationResult[value=" + value + "]" : "EvaluationResult[error=" + error + "]";
    }
}

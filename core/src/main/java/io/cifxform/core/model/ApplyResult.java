package io.cifxform.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of running rules over a document: the rewritten text and one human-readable entry per
 * applied operation, in the order they happened. The input text is never modified.
 *
 * @param content the rewritten document text
 * @param operations the operation log, e.g. {@code "RENAMED: _a -> _b"}
 */
public record ApplyResult(String content, List<String> operations) {

    public ApplyResult {
        Objects.requireNonNull(content, "content must not be null");
        operations = List.copyOf(operations);
    }

    /** A result that leaves {@code content} untouched and logs nothing. */
    public static ApplyResult unchanged(String content) {
        return new ApplyResult(content, List.of());
    }

    /** Returns {@code true} if at least one operation was logged. */
    public boolean changed() {
        return !operations.isEmpty();
    }

    /** Chains another step: its content replaces this one's, and the logs concatenate. */
    public ApplyResult then(ApplyResult next) {
        List<String> merged = new ArrayList<>(operations);
        merged.addAll(next.operations());
        return new ApplyResult(next.content(), merged);
    }
}

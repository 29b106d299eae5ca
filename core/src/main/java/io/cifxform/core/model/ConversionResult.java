package io.cifxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of converting a document between CIF dialects.
 *
 * @param content the converted text
 * @param changes human-readable change log, in document order
 * @param unknownFields data names the dictionary does not know, first-seen order
 */
public record ConversionResult(String content, List<String> changes, List<String> unknownFields) {

    public ConversionResult {
        Objects.requireNonNull(content, "content must not be null");
        changes = List.copyOf(changes);
        unknownFields = List.copyOf(unknownFields);
    }
}

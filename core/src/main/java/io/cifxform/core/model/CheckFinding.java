package io.cifxform.core.model;

import java.util.List;

/**
 * Result of evaluating one CHECK rule against a document.
 *
 * @param field the checked data name
 * @param present whether the document contains the field
 * @param currentValue the value found on the field's line, or {@code null} when absent or when
 *     the value is a semicolon block
 * @param defaultValue the rule's default value
 * @param suggestions the rule's suggested values
 * @param description the rule's description
 */
public record CheckFinding(
        String field,
        boolean present,
        String currentValue,
        String defaultValue,
        List<String> suggestions,
        String description) {

    public CheckFinding {
        suggestions = List.copyOf(suggestions);
    }

    /** Returns {@code true} if the field is present and its value is one of the suggestions. */
    public boolean matchesSuggestion() {
        return present && currentValue != null && suggestions.contains(currentValue);
    }
}

package io.cifxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An ordered, immutable set of field rules loaded from one rules file. The same rule set may be
 * applied to any number of documents.
 *
 * @param rules rules in first-seen order
 * @param source the file or resource the rules came from, for log messages
 */
public record RuleSet(List<FieldRule> rules, String source) {

    public RuleSet {
        rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        source = source != null ? source : "<inline>";
    }

    /** Creates a rule set with no source label. */
    public static RuleSet of(List<FieldRule> rules) {
        return new RuleSet(rules, null);
    }

    /** Returns the rules of one variant, in order. */
    public <T extends FieldRule> List<T> rulesOfType(Class<T> type) {
        return rules.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}

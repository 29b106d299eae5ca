package io.cifxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single policy for one CIF data name, loaded from a field-rules file.
 *
 * <p>Implementations are a sealed hierarchy with one variant per {@link RuleAction}; each variant
 * carries only the payload its action needs, so a rename always has a target and a calculation
 * always has an expression.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface FieldRule {

    /** The data name this rule applies to (for {@link Rename}, the old name). */
    String name();

    /** Free-text description collected from the rules file, never null. */
    String description();

    /** The action this variant performs. */
    RuleAction action();

    // ── Implementations ──

    /**
     * Checks that a field is present. Repeated lines for the same field aggregate: {@code
     * suggestions} holds every distinct observed value in first-seen order and {@code defaultValue}
     * the first non-empty one.
     */
    record Check(String name, String defaultValue, String description, List<String> suggestions)
            implements FieldRule {
        public Check {
            Objects.requireNonNull(name, "name must not be null");
            defaultValue = defaultValue != null ? defaultValue : "";
            description = description != null ? description : "";
            suggestions = List.copyOf(suggestions);
        }

        @Override
        public RuleAction action() {
            return RuleAction.CHECK;
        }
    }

    /** Removes every occurrence of a field. */
    record Delete(String name, String description) implements FieldRule {
        public Delete {
            Objects.requireNonNull(name, "name must not be null");
            description = description != null ? description : "";
        }

        @Override
        public RuleAction action() {
            return RuleAction.DELETE;
        }
    }

    /** Overwrites a field's value. An empty {@code value} removes the field instead. */
    record Edit(String name, String value, String description) implements FieldRule {
        public Edit {
            Objects.requireNonNull(name, "name must not be null");
            value = value != null ? value : "";
            description = description != null ? description : "";
        }

        @Override
        public RuleAction action() {
            return RuleAction.EDIT;
        }
    }

    /**
     * Appends text to the end of a semicolon-delimited field value. Repeated lines for the same
     * field concatenate, separated by a blank line.
     */
    record Append(String name, String text, String description) implements FieldRule {
        public Append {
            Objects.requireNonNull(name, "name must not be null");
            text = text != null ? text : "";
            description = description != null ? description : "";
        }

        @Override
        public RuleAction action() {
            return RuleAction.APPEND;
        }
    }

    /** Renames a data name token, keeping the rest of the line. */
    record Rename(String name, String target, String description) implements FieldRule {
        public Rename {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(target, "target must not be null");
            description = description != null ? description : "";
        }

        @Override
        public RuleAction action() {
            return RuleAction.RENAME;
        }
    }

    /** Computes a numeric field from an arithmetic expression over other fields. */
    record Calculate(String name, String expression, String description) implements FieldRule {
        public Calculate {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
            description = description != null ? description : "";
        }

        @Override
        public RuleAction action() {
            return RuleAction.CALCULATE;
        }
    }
}

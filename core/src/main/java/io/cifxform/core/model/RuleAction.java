package io.cifxform.core.model;

import java.util.Locale;
import java.util.Optional;

/** The action a field rule performs. {@link #CHECK} is implied when a rule line has no prefix. */
public enum RuleAction {
    CHECK,
    DELETE,
    EDIT,
    APPEND,
    RENAME,
    CALCULATE;

    /** The prefix that selects this action in a rules file, e.g. {@code "RENAME:"}. */
    public String prefix() {
        return name() + ":";
    }

    /**
     * Resolves an action keyword, case-insensitively.
     *
     * @param keyword the keyword without its trailing colon
     * @return the action, or empty if the keyword names none
     */
    public static Optional<RuleAction> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String upper = keyword.trim().toUpperCase(Locale.ROOT);
        for (RuleAction action : values()) {
            if (action.name().equals(upper)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}

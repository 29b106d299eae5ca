package io.cifxform.core.model;

import java.util.Objects;

/**
 * An alternate name for a canonical CIF2 field, as listed in the dictionary's {@code
 * _alias.definition_id} entries.
 *
 * @param name the alias, usually a CIF1 flat name
 * @param deprecationDate the {@code _alias.deprecation_date} token, {@code "."}, or {@code null}
 */
public record FieldAlias(String name, String deprecationDate) {

    /** The dictionary token meaning "no date". */
    public static final String NO_DATE = ".";

    public FieldAlias {
        Objects.requireNonNull(name, "name must not be null");
    }

    public FieldAlias(String name) {
        this(name, null);
    }

    /** An alias is deprecated iff it carries a real date (anything but {@code "."}). */
    public boolean isDeprecated() {
        return deprecationDate != null && !NO_DATE.equals(deprecationDate);
    }
}

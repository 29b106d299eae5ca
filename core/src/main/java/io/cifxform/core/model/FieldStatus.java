package io.cifxform.core.model;

import java.util.Locale;

/** Where a data name is known from. */
public enum FieldStatus {
    OFFICIAL,
    CIF2_ONLY_EXTENSION,
    UNKNOWN;

    /** Lowercase label, e.g. {@code "cif2_only_extension"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

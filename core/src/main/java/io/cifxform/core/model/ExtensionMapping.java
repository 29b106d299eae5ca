package io.cifxform.core.model;

import java.util.Objects;

/**
 * A CIF2 name that the official dictionary defines without any CIF1 alias, paired with the CIF1
 * spelling used for it.
 */
public record ExtensionMapping(String cif2Name, String cif1Name) {

    public ExtensionMapping {
        Objects.requireNonNull(cif2Name, "cif2Name must not be null");
        Objects.requireNonNull(cif1Name, "cif1Name must not be null");
    }
}

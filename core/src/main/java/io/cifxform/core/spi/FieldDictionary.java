package io.cifxform.core.spi;

import java.util.Optional;

/**
 * Read-only view of CIF1/CIF2 name mappings. Implemented by the dictionary parser and by the
 * extension overlay that wraps it, so callers can work against either.
 *
 * <p>All lookups are case-insensitive. Implementations must be safe for concurrent reads once
 * loaded.
 */
public interface FieldDictionary {

    /** The canonical CIF2 name for a CIF1 alias. */
    Optional<String> getCif2Equivalent(String cif1Name);

    /** The preferred CIF1 alias for a CIF2 name. */
    Optional<String> getCif1Equivalent(String cif2Name);

    /** Returns {@code true} if the name is defined, as a canonical name or any alias. */
    boolean isKnownField(String name);

    /** Returns {@code true} if the name is deprecated or belongs to a replaced definition. */
    boolean isFieldDeprecated(String name);

    /** The named replacement of a replaced definition, looked up by canonical name or alias. */
    Optional<String> getReplacementField(String name);
}

package io.cifxform.core.dictionary;

import io.cifxform.core.model.FieldStatus;
import io.cifxform.core.spi.FieldDictionary;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link FieldDictionary} that falls back to the CIF2-only extension table when the base
 * dictionary has no answer.
 *
 * <p>The base is always asked first, so the official dictionary wins whenever it defines a name.
 * Deprecation and replacement queries go straight to the base.
 */
public final class ExtensionOverlay implements FieldDictionary {

    private final FieldDictionary base;
    private final ExtensionMappings extensions;

    public ExtensionOverlay(FieldDictionary base, ExtensionMappings extensions) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.extensions = Objects.requireNonNull(extensions, "extensions must not be null");
    }

    /** Wraps {@code base} with the bundled extension table. */
    public static ExtensionOverlay withBundledExtensions(FieldDictionary base) {
        return new ExtensionOverlay(base, ExtensionMappings.bundled());
    }

    public FieldDictionary base() {
        return base;
    }

    public ExtensionMappings extensions() {
        return extensions;
    }

    @Override
    public Optional<String> getCif2Equivalent(String cif1Name) {
        Optional<String> official = base.getCif2Equivalent(cif1Name);
        return official.isPresent() ? official : extensions.cif2For(cif1Name);
    }

    @Override
    public Optional<String> getCif1Equivalent(String cif2Name) {
        Optional<String> official = base.getCif1Equivalent(cif2Name);
        return official.isPresent() ? official : extensions.cif1For(cif2Name);
    }

    @Override
    public boolean isKnownField(String name) {
        return base.isKnownField(name) || extensions.contains(name);
    }

    @Override
    public boolean isFieldDeprecated(String name) {
        return base.isFieldDeprecated(name);
    }

    @Override
    public Optional<String> getReplacementField(String name) {
        return base.getReplacementField(name);
    }

    /** Returns {@code true} if the name is only known from the extension table. */
    public boolean isCif2OnlyExtension(String name) {
        return !base.isKnownField(name) && extensions.contains(name);
    }

    /** Where a name is known from, official dictionary first. */
    public FieldStatus getFieldStatus(String name) {
        if (base.isKnownField(name)) {
            return FieldStatus.OFFICIAL;
        }
        if (extensions.contains(name)) {
            return FieldStatus.CIF2_ONLY_EXTENSION;
        }
        return FieldStatus.UNKNOWN;
    }
}

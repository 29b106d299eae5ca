package io.cifxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One field definition read from a dictionary save block.
 *
 * @param name canonical CIF2 name ({@code _definition.id})
 * @param aliases aliases in dictionary order
 * @param replaced whether the block carries a {@code _definition_replaced} marker
 * @param replacementField the named replacement, or {@code null}
 * @param typeContents {@code _type.contents}, e.g. {@code Real}
 * @param typePurpose {@code _type.purpose}
 * @param typeContainer {@code _type.container}
 * @param typeSource {@code _type.source}
 * @param categoryId {@code _name.category_id}
 * @param description {@code _description.text}
 * @param enumerationValues allowed states from {@code _enumeration_set.state}, empty if none
 */
public record DictionaryEntry(
        String name,
        List<FieldAlias> aliases,
        boolean replaced,
        String replacementField,
        String typeContents,
        String typePurpose,
        String typeContainer,
        String typeSource,
        String categoryId,
        String description,
        List<String> enumerationValues) {

    public DictionaryEntry {
        Objects.requireNonNull(name, "name must not be null");
        aliases = List.copyOf(aliases);
        enumerationValues = List.copyOf(enumerationValues);
    }

    /** Alias names that carry no deprecation date, in dictionary order. */
    public List<String> nonDeprecatedAliases() {
        return aliases.stream()
                .filter(a -> !a.isDeprecated())
                .map(FieldAlias::name)
                .toList();
    }

    /** All alias names, in dictionary order. */
    public List<String> aliasNames() {
        return aliases.stream().map(FieldAlias::name).toList();
    }

    /** Returns {@code true} if the field is replaced or any alias is deprecated. */
    public boolean isDeprecated() {
        return replaced || aliases.stream().anyMatch(FieldAlias::isDeprecated);
    }
}

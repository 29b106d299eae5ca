package io.cifxform.core.dictionary;

import io.cifxform.core.model.DictionaryEntry;
import io.cifxform.core.model.DictionaryTables;
import io.cifxform.core.model.FieldAlias;
import io.cifxform.core.spi.FieldDictionary;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a DDLm dictionary into CIF1/CIF2 alias tables and per-field metadata.
 *
 * <p>Each {@code save_} block that carries a {@code _definition.id} defines one field. Category
 * blocks (all-uppercase block names, or {@code _definition.scope Category}) are skipped. For every
 * field:
 *
 * <ul>
 * <li>If the block has a {@code _definition_replaced} marker, all its aliases are deprecated and
 * map to the named replacement, or to the field itself when the replacement is {@code .}.
 * <li>Otherwise aliases without a deprecation date map to the field in both directions, and
 * dated aliases are recorded as deprecated but left out of the maps.
 * </ul>
 *
 * <p>Map keys are lowercase; values keep the dictionary's spelling. Every query is
 * case-insensitive.
 *
 * <p>The dictionary is read and parsed once, on first use, under a lock; afterwards all queries are
 * lock-free reads of immutable state. {@link #invalidate()} discards the cached result so the next
 * query re-reads the source.
 */
public final class DictionaryParser implements FieldDictionary {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryParser.class);

    private static final String DEFINITION_ID = "_definition.id";
    private static final String DEFINITION_SCOPE = "_definition.scope";
    private static final String REPLACED_ID = "_definition_replaced.id";
    private static final String REPLACED_BY = "_definition_replaced.by";
    private static final String ALIAS_ID = "_alias.definition_id";
    private static final String ALIAS_DATE = "_alias.deprecation_date";
    private static final String ENUMERATION_STATE = "_enumeration_set.state";

    private final DictionarySource source;
    private final Object lock = new Object();
    private volatile Parsed parsed;

    public DictionaryParser(DictionarySource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /** The source this parser reads. */
    public DictionarySource source() {
        return source;
    }

    /**
     * Parses the dictionary, or returns the cached tables from an earlier call.
     *
     * @throws io.cifxform.core.error.DictionaryNotFoundException if the source cannot be read
     */
    public DictionaryTables parse() {
        return state().tables;
    }

    /** Returns {@code true} once the dictionary has been parsed and not invalidated since. */
    public boolean isParsed() {
        return parsed != null;
    }

    /** Drops the cached parse result. */
    public void invalidate() {
        synchronized (lock) {
            parsed = null;
        }
    }

    // ── Queries ──

    /** The canonical CIF2 name (or replacement) for a live or replaced alias. */
    public Optional<String> getCif2Field(String cif1Name) {
        if (cif1Name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state().tables.cif1ToCif2().get(lower(cif1Name)));
    }

    /**
     * The preferred CIF1 alias of a CIF2 field: the first non-deprecated alias without a dot, else
     * the first non-deprecated alias.
     */
    public Optional<String> getCif1Field(String cif2Name) {
        List<String> aliases = getNonDeprecatedAliases(cif2Name);
        for (String alias : aliases) {
            if (alias.indexOf('.') < 0) {
                return Optional.of(alias);
            }
        }
        return aliases.isEmpty() ? Optional.empty() : Optional.of(aliases.get(0));
    }

    /** Aliases of a CIF2 field with their deprecation dates, empty if the field is unknown. */
    public List<FieldAlias> getFieldAliasesInfo(String cif2Name) {
        DictionaryEntry entry = cif2Name == null ? null : state().byDefinition.get(lower(cif2Name));
        return entry != null ? entry.aliases() : List.of();
    }

    /** Alias names of a CIF2 field that carry no deprecation date. */
    public List<String> getNonDeprecatedAliases(String cif2Name) {
        DictionaryEntry entry = cif2Name == null ? null : state().byDefinition.get(lower(cif2Name));
        return entry != null ? entry.nonDeprecatedAliases() : List.of();
    }

    /** The canonical {@code _definition.id} for a canonical name or any alias. */
    public Optional<String> getDefinitionId(String name) {
        return getEntry(name).map(DictionaryEntry::name);
    }

    /** The full entry for a canonical name or any alias. */
    public Optional<DictionaryEntry> getEntry(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state().byAnyName.get(lower(name)));
    }

    /**
     * All names of a field: the canonical name first (when it is not itself listed as an alias),
     * then the aliases.
     *
     * @param name canonical name or any alias
     * @param includeDeprecated whether to include dated aliases
     */
    public List<String> getAllAliases(String name, boolean includeDeprecated) {
        Optional<DictionaryEntry> entry = getEntry(name);
        if (entry.isEmpty()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(
                includeDeprecated ? entry.get().aliasNames() : entry.get().nonDeprecatedAliases());
        if (!names.contains(entry.get().name())) {
            names.add(0, entry.get().name());
        }
        return List.copyOf(names);
    }

    /** Every parsed field definition, in dictionary order. */
    public Collection<DictionaryEntry> entries() {
        return state().byDefinition.values();
    }

    @Override
    public Optional<String> getCif2Equivalent(String cif1Name) {
        return getCif2Field(cif1Name);
    }

    @Override
    public Optional<String> getCif1Equivalent(String cif2Name) {
        return getCif1Field(cif2Name);
    }

    /** Returns {@code true} for any canonical name or alias, deprecated ones included. */
    @Override
    public boolean isKnownField(String name) {
        return name != null && state().byAnyName.containsKey(lower(name));
    }

    /** Returns {@code true} for dated aliases, aliases of replaced fields and replaced fields. */
    @Override
    public boolean isFieldDeprecated(String name) {
        return name != null && state().deprecated.contains(lower(name));
    }

    /** The replacement named by a replaced definition, looked up by canonical name or alias. */
    @Override
    public Optional<String> getReplacementField(String name) {
        return getEntry(name)
                .filter(DictionaryEntry::replaced)
                .map(DictionaryEntry::replacementField);
    }

    // ── Parsing ──

    private Parsed state() {
        Parsed current = parsed;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (parsed == null) {
                parsed = build(source);
            }
            return parsed;
        }
    }

    private static Parsed build(DictionarySource source) {
        String text = source.read();
        Map<String, String> cif1ToCif2 = new HashMap<>();
        Map<String, List<String>> cif2ToCif1 = new HashMap<>();
        Map<String, DictionaryEntry> byDefinition = new LinkedHashMap<>();
        Map<String, DictionaryEntry> byAnyName = new HashMap<>();
        Set<String> deprecated = new HashSet<>();
        int skipped = 0;

        for (SaveBlockReader.SaveBlock saveBlock : SaveBlockReader.read(text)) {
            if (isCategoryName(saveBlock.name())) {
                continue;
            }
            DictionaryBlock block = DictionaryBlock.parse(saveBlock.name(), saveBlock.body());
            Optional<DictionaryEntry> maybeEntry = toEntry(block);
            if (maybeEntry.isEmpty()) {
                skipped++;
                continue;
            }
            DictionaryEntry entry = maybeEntry.get();
            String id = entry.name();
            byDefinition.put(lower(id), entry);
            byAnyName.put(lower(id), entry);
            for (FieldAlias alias : entry.aliases()) {
                byAnyName.put(lower(alias.name()), entry);
            }

            if (entry.replaced()) {
                deprecated.add(lower(id));
                String target = entry.replacementField() != null ? entry.replacementField() : id;
                for (FieldAlias alias : entry.aliases()) {
                    deprecated.add(lower(alias.name()));
                    link(cif1ToCif2, cif2ToCif1, alias.name(), target);
                }
            } else {
                for (FieldAlias alias : entry.aliases()) {
                    if (alias.isDeprecated()) {
                        deprecated.add(lower(alias.name()));
                    } else if (!alias.name().equalsIgnoreCase(id)) {
                        link(cif1ToCif2, cif2ToCif1, alias.name(), id);
                    }
                }
            }
        }

        Map<String, List<String>> frozenReverse = new HashMap<>();
        cif2ToCif1.forEach((k, v) -> frozenReverse.put(k, List.copyOf(v)));
        DictionaryTables tables = new DictionaryTables(cif1ToCif2, frozenReverse);
        LOG.info(
                "Parsed dictionary {}: {} definitions, {} alias mappings, {} deprecated names ({} blocks skipped)",
                source.name(),
                byDefinition.size(),
                cif1ToCif2.size(),
                deprecated.size(),
                skipped);
        return new Parsed(
                tables,
                Collections.unmodifiableMap(byDefinition),
                Map.copyOf(byAnyName),
                Set.copyOf(deprecated));
    }

    private static void link(
            Map<String, String> cif1ToCif2, Map<String, List<String>> cif2ToCif1, String alias, String target) {
        cif1ToCif2.put(lower(alias), target);
        List<String> reverse = cif2ToCif1.computeIfAbsent(lower(target), k -> new ArrayList<>());
        if (reverse.stream().noneMatch(alias::equalsIgnoreCase)) {
            reverse.add(alias);
        }
    }

    /** Builds the entry for a field block, or empty for blocks that define no field. */
    static Optional<DictionaryEntry> toEntry(DictionaryBlock block) {
        String id = block.value(DEFINITION_ID);
        if (id == null || id.isBlank()) {
            LOG.debug("Skipping save block {}: no {}", block.name(), DEFINITION_ID);
            return Optional.empty();
        }
        if ("category".equalsIgnoreCase(block.value(DEFINITION_SCOPE))) {
            return Optional.empty();
        }

        boolean replaced = block.has(REPLACED_ID) || block.has(REPLACED_BY);
        String replacement = null;
        for (String by : block.values(REPLACED_BY)) {
            if (!isNull(by)) {
                replacement = by;
                break;
            }
        }

        return Optional.of(new DictionaryEntry(
                id,
                aliases(block),
                replaced,
                replacement,
                block.value("_type.contents"),
                block.value("_type.purpose"),
                block.value("_type.container"),
                block.value("_type.source"),
                block.value("_name.category_id"),
                description(block.value("_description.text")),
                block.values(ENUMERATION_STATE)));
    }

    private static List<FieldAlias> aliases(DictionaryBlock block) {
        List<FieldAlias> aliases = new ArrayList<>();
        DictionaryBlock.Loop loop = block.loopWith(ALIAS_ID);
        if (loop != null) {
            int nameCol = loop.columnIndex(ALIAS_ID);
            int dateCol = loop.columnIndex(ALIAS_DATE);
            for (List<String> row : loop.rows()) {
                aliases.add(new FieldAlias(row.get(nameCol), dateCol >= 0 ? row.get(dateCol) : null));
            }
        } else if (block.value(ALIAS_ID) != null) {
            aliases.add(new FieldAlias(block.value(ALIAS_ID), block.value(ALIAS_DATE)));
        }
        return aliases;
    }

    private static String description(String text) {
        return text != null ? text.strip() : null;
    }

    private static boolean isNull(String value) {
        return value == null || ".".equals(value) || "?".equals(value);
    }

    /** Category blocks use an all-uppercase name, e.g. {@code save_CELL}. */
    private static boolean isCategoryName(String name) {
        return name.chars().anyMatch(Character::isLetter) && name.equals(name.toUpperCase(Locale.ROOT));
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private record Parsed(
            DictionaryTables tables,
            Map<String, DictionaryEntry> byDefinition,
            Map<String, DictionaryEntry> byAnyName,
            Set<String> deprecated) {}
}

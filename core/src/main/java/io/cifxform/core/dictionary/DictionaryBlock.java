package io.cifxform.core.dictionary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The tags and loops of one save block. Tag lookups are case-insensitive.
 *
 * <p>A tag may appear either as a single item or as a loop column; {@link #values(String)} reads
 * both forms the same way.
 */
final class DictionaryBlock {

    /** A {@code loop_} table: column tags and rows of values. */
    record Loop(List<String> columns, List<List<String>> rows) {

        int columnIndex(String tag) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).equalsIgnoreCase(tag)) {
                    return i;
                }
            }
            return -1;
        }
    }

    /** Attribute categories of the DDLm reference dictionary. */
    private static final Set<String> DDL_CATEGORIES = Set.of(
            "alias",
            "category",
            "category_key",
            "definition",
            "definition_replaced",
            "description",
            "description_example",
            "dictionary",
            "dictionary_audit",
            "dictionary_valid",
            "enumeration",
            "enumeration_default",
            "enumeration_set",
            "import",
            "method",
            "name",
            "type",
            "units");

    private final String name;
    private final Map<String, String> items;
    private final List<Loop> loops;

    private DictionaryBlock(String name, Map<String, String> items, List<Loop> loops) {
        this.name = name;
        this.items = items;
        this.loops = loops;
    }

    static DictionaryBlock parse(String name, String body) {
        List<BlockTokenizer.Token> tokens = BlockTokenizer.tokenize(body);
        Map<String, String> items = new HashMap<>();
        List<Loop> loops = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            BlockTokenizer.Token token = tokens.get(i);
            switch (token.type()) {
                case LOOP -> {
                    i++;
                    List<String> columns = new ArrayList<>();
                    while (i < tokens.size()
                            && tokens.get(i).type() == BlockTokenizer.Type.TAG
                            && isAttribute(tokens.get(i).text())) {
                        columns.add(tokens.get(i).text());
                        i++;
                    }
                    // Unquoted data names in the rows read as tags; only DDL attributes end the rows.
                    List<String> cells = new ArrayList<>();
                    while (i < tokens.size() && isValue(tokens.get(i))) {
                        cells.add(tokens.get(i).text());
                        i++;
                    }
                    if (!columns.isEmpty()) {
                        loops.add(new Loop(List.copyOf(columns), rows(cells, columns.size())));
                    }
                }
                case TAG -> {
                    i++;
                    if (i < tokens.size() && isValue(tokens.get(i))) {
                        items.putIfAbsent(key(token.text()), tokens.get(i).text());
                        i++;
                    }
                }
                case VALUE -> i++;
            }
        }
        return new DictionaryBlock(name, items, loops);
    }

    /** Returns {@code true} if the tag names a DDLm attribute rather than a dictionary data name. */
    static boolean isAttribute(String tag) {
        int dot = tag.indexOf('.');
        return dot > 1 && DDL_CATEGORIES.contains(key(tag.substring(1, dot)));
    }

    private static boolean isValue(BlockTokenizer.Token token) {
        return token.type() == BlockTokenizer.Type.VALUE
                || (token.type() == BlockTokenizer.Type.TAG && !isAttribute(token.text()));
    }

    private static List<List<String>> rows(List<String> cells, int width) {
        List<List<String>> rows = new ArrayList<>();
        for (int start = 0; start + width <= cells.size(); start += width) {
            rows.add(List.copyOf(cells.subList(start, start + width)));
        }
        return rows;
    }

    private static String key(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }

    String name() {
        return name;
    }

    /** The single-item value of {@code tag}, or {@code null}. */
    String value(String tag) {
        return items.get(key(tag));
    }

    /** Returns {@code true} if the tag appears as an item or a loop column. */
    boolean has(String tag) {
        return items.containsKey(key(tag)) || loopWith(tag) != null;
    }

    /** Every value of {@code tag}: the loop column if looped, else the single item, else empty. */
    List<String> values(String tag) {
        Loop loop = loopWith(tag);
        if (loop != null) {
            int col = loop.columnIndex(tag);
            return loop.rows().stream().map(row -> row.get(col)).toList();
        }
        String single = value(tag);
        return single != null ? List.of(single) : List.of();
    }

    /** The first loop that has {@code tag} as a column, or {@code null}. */
    Loop loopWith(String tag) {
        for (Loop loop : loops) {
            if (loop.columnIndex(tag) >= 0) {
                return loop;
            }
        }
        return null;
    }
}

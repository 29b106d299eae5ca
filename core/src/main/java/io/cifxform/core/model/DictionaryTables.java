package io.cifxform.core.model;

import java.util.List;
import java.util.Map;

/**
 * The two alias maps built from a dictionary. Keys are lowercase; values keep the dictionary's
 * spelling.
 *
 * @param cif1ToCif2 live alias to canonical CIF2 name
 * @param cif2ToCif1 canonical CIF2 name to its live aliases, first-seen order, no duplicates
 */
public record DictionaryTables(Map<String, String> cif1ToCif2, Map<String, List<String>> cif2ToCif1) {

    public DictionaryTables {
        cif1ToCif2 = Map.copyOf(cif1ToCif2);
        cif2ToCif1 = Map.copyOf(cif2ToCif1);
    }
}

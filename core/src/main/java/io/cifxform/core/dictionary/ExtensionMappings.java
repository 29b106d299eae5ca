package io.cifxform.core.dictionary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.cifxform.core.error.ExtensionTableException;
import io.cifxform.core.model.ExtensionMapping;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of CIF2-only extension names and their CIF1 spellings.
 *
 * <p>Read from YAML of the form:
 *
 * <pre>
 * extensions:
 *   - cif2: _refine_diff.potential_max
 *     cif1: _refine_diff_potential_max
 * </pre>
 */
public final class ExtensionMappings {

    /** Classpath location of the bundled table. */
    public static final String BUNDLED_RESOURCE = "cif2-only-extensions.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final List<ExtensionMapping> mappings;
    private final Map<String, String> cif2ToCif1;
    private final Map<String, String> cif1ToCif2;

    public ExtensionMappings(List<ExtensionMapping> mappings) {
        this.mappings = List.copyOf(Objects.requireNonNull(mappings, "mappings must not be null"));
        Map<String, String> forward = new HashMap<>();
        Map<String, String> reverse = new HashMap<>();
        for (ExtensionMapping m : this.mappings) {
            forward.put(lower(m.cif2Name()), m.cif1Name());
            reverse.put(lower(m.cif1Name()), m.cif2Name());
        }
        this.cif2ToCif1 = Map.copyOf(forward);
        this.cif1ToCif2 = Map.copyOf(reverse);
    }

    /**
     * Loads the table shipped with this library.
     *
     * @throws ExtensionTableException if the resource is missing or malformed
     */
    public static ExtensionMappings bundled() {
        try (InputStream in = ExtensionMappings.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new ExtensionTableException("Bundled extension table not found", BUNDLED_RESOURCE);
            }
            return parse(YAML_MAPPER.readTree(in), BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new ExtensionTableException(
                    "Cannot read bundled extension table: " + e.getMessage(), e, BUNDLED_RESOURCE);
        }
    }

    /**
     * Loads a table from a YAML file.
     *
     * @throws ExtensionTableException if the file is missing or malformed
     */
    public static ExtensionMappings load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new ExtensionTableException("Extension table not found: " + path, source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new ExtensionTableException("Cannot read extension table: " + e.getMessage(), e, source);
        }
    }

    private static ExtensionMappings parse(JsonNode root, String source) {
        if (root == null || !root.path("extensions").isArray()) {
            throw new ExtensionTableException("Extension table must have an 'extensions' list", source);
        }
        List<ExtensionMapping> mappings = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root.get("extensions")) {
            String cif2 = node.path("cif2").asText("");
            String cif1 = node.path("cif1").asText("");
            if (!cif2.startsWith("_") || !cif1.startsWith("_")) {
                throw new ExtensionTableException(
                        "Entry " + index + " needs 'cif2' and 'cif1' data names, got: " + node, source);
            }
            mappings.add(new ExtensionMapping(cif2, cif1));
            index++;
        }
        return new ExtensionMappings(mappings);
    }

    /** The CIF1 spelling of a CIF2-only name. */
    public Optional<String> cif1For(String cif2Name) {
        return cif2Name == null ? Optional.empty() : Optional.ofNullable(cif2ToCif1.get(lower(cif2Name)));
    }

    /** The CIF2 name behind a CIF1 spelling. */
    public Optional<String> cif2For(String cif1Name) {
        return cif1Name == null ? Optional.empty() : Optional.ofNullable(cif1ToCif2.get(lower(cif1Name)));
    }

    /** Returns {@code true} if the name appears on either side of the table. */
    public boolean contains(String name) {
        return name != null && (cif2ToCif1.containsKey(lower(name)) || cif1ToCif2.containsKey(lower(name)));
    }

    public List<ExtensionMapping> mappings() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}

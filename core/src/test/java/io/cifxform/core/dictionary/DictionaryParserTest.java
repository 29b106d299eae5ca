package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.cifxform.core.error.DictionaryNotFoundException;
import io.cifxform.core.model.DictionaryEntry;
import io.cifxform.core.model.DictionaryTables;
import io.cifxform.core.model.FieldAlias;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DictionaryParser")
class DictionaryParserTest {

    private DictionaryParser parser;

    @BeforeEach
    void setUp() {
        parser = new DictionaryParser(TestDictionaries.testDictionary());
    }

    @Nested
    @DisplayName("alias tables")
    class Tables {

        @Test
        void liveAliasesMapBothWays() {
            assertThat(parser.getCif2Field("_cell_length_a")).contains("_cell.length_a");
            assertThat(parser.getCif1Field("_cell.length_a")).contains("_cell_length_a");
        }

        @Test
        void lookupsIgnoreCase() {
            assertThat(parser.getCif2Field("_CELL_LENGTH_A")).contains("_cell.length_a");
            assertThat(parser.getCif1Field("_Cell.Length_A")).contains("_cell_length_a");
            assertThat(parser.isKnownField("_SPACE_GROUP.NAME_H-M_ALT")).isTrue();
        }

        @Test
        @DisplayName("dated aliases are deprecated and left out of the maps")
        void datedAliases() {
            assertThat(parser.getCif2Field("_diffrn_ambient_temp")).isEmpty();
            assertThat(parser.isFieldDeprecated("_diffrn_ambient_temp")).isTrue();
            assertThat(parser.isKnownField("_diffrn_ambient_temp")).isTrue();
            assertThat(parser.getCif2Field("_diffrn_ambient_temperature")).contains("_diffrn.ambient_temperature");
            assertThat(parser.isFieldDeprecated("_diffrn_ambient_temperature")).isFalse();
        }

        @Test
        void replacedDefinitionMapsAliasesToReplacement() {
            assertThat(parser.getCif2Field("_symmetry_space_group_name_H-M")).contains("_space_group.name_H-M_alt");
            assertThat(parser.isFieldDeprecated("_symmetry.space_group_name_H-M")).isTrue();
            assertThat(parser.isFieldDeprecated("_symmetry_space_group_name_H-M")).isTrue();
            assertThat(parser.getReplacementField("_symmetry_space_group_name_H-M"))
                    .contains("_space_group.name_H-M_alt");
        }

        @Test
        void replacedWithoutTargetMapsToItself() {
            assertThat(parser.getCif2Field("_refine_obsolete_flag")).contains("_refine.obsolete_flag");
            assertThat(parser.isFieldDeprecated("_refine.obsolete_flag")).isTrue();
            assertThat(parser.getReplacementField("_refine.obsolete_flag")).isEmpty();
        }

        @Test
        @DisplayName("preferred CIF1 alias is the first one without a dot")
        void preferredCif1Alias() {
            assertThat(parser.getCif1Field("_space_group.name_H-M_alt")).contains("_space_group_name_H-M_alt");
            assertThat(parser.getCif1Field("_unknown.field")).isEmpty();
        }

        @Test
        void tablesHaveLowercaseKeysAndOriginalValues() {
            DictionaryTables tables = parser.parse();

            assertThat(tables.cif1ToCif2())
                    .hasSize(6)
                    .containsEntry("_symmetry_space_group_name_h-m", "_space_group.name_H-M_alt");
            assertThat(tables.cif2ToCif1().get("_space_group.name_h-m_alt"))
                    .containsExactly("_symmetry_space_group_name_H-M", "_space_group_name_H-M_alt");
        }
    }

    @Nested
    @DisplayName("entries")
    class Entries {

        @Test
        @DisplayName("category and id-less blocks are skipped")
        void onlyFieldDefinitions() {
            assertThat(parser.entries())
                    .extracting(DictionaryEntry::name)
                    .containsExactly(
                            "_cell.length_a",
                            "_diffrn.ambient_temperature",
                            "_symmetry.space_group_name_H-M",
                            "_space_group.name_H-M_alt",
                            "_refine.obsolete_flag",
                            "_exptl.legacy_note");
            assertThat(parser.isKnownField("CELL")).isFalse();
        }

        @Test
        void entryCarriesMetadata() {
            DictionaryEntry entry = parser.getEntry("_cell_length_a").orElseThrow();

            assertThat(entry.name()).isEqualTo("_cell.length_a");
            assertThat(entry.typeContents()).isEqualTo("Real");
            assertThat(entry.typePurpose()).isEqualTo("Measurand");
            assertThat(entry.typeSource()).isEqualTo("Recorded");
            assertThat(entry.typeContainer()).isEqualTo("Single");
            assertThat(entry.categoryId()).isEqualTo("cell");
            assertThat(entry.description()).isEqualTo("Length of the a axis of the unit cell.");
        }

        @Test
        void enumerationValuesComeFromTheLoop() {
            assertThat(parser.getEntry("_space_group.name_H-M_alt").orElseThrow().enumerationValues())
                    .containsExactly("P 1", "P 21/c");
        }

        @Test
        void aliasInfoKeepsDates() {
            assertThat(parser.getFieldAliasesInfo("_diffrn.ambient_temperature"))
                    .containsExactly(
                            new FieldAlias("_diffrn_ambient_temperature", "."),
                            new FieldAlias("_diffrn_ambient_temp", "2023-01-01"));
            assertThat(parser.getNonDeprecatedAliases("_diffrn.ambient_temperature"))
                    .containsExactly("_diffrn_ambient_temperature");
        }

        @Test
        void allAliasesStartWithCanonicalName() {
            assertThat(parser.getAllAliases("_diffrn_ambient_temp", true))
                    .containsExactly(
                            "_diffrn.ambient_temperature", "_diffrn_ambient_temperature", "_diffrn_ambient_temp");
            assertThat(parser.getAllAliases("_diffrn_ambient_temp", false))
                    .containsExactly("_diffrn.ambient_temperature", "_diffrn_ambient_temperature");
            assertThat(parser.getAllAliases("_space_group.name_H-M_alt", false))
                    .containsExactly("_space_group_name_H-M_alt", "_space_group.name_H-M_alt");
            assertThat(parser.getDefinitionId("_symmetry_space_group_name_H-M"))
                    .contains("_symmetry.space_group_name_H-M");
        }
    }

    @Test
    @DisplayName("unquoted data names in alias loops are read as values")
    void unquotedAliasNames() {
        String text = String.join(
                "\n",
                "save_cell.length_b",
                "    _definition.id  _cell.length_b",
                "    loop_",
                "      _alias.definition_id",
                "        _cell_length_b",
                "        _cell.b",
                "    _type.contents  Real",
                "save_");

        DictionaryParser inline = new DictionaryParser(DictionarySource.ofText("inline", text));

        assertThat(inline.getNonDeprecatedAliases("_cell.length_b")).containsExactly("_cell_length_b", "_cell.b");
        assertThat(inline.getEntry("_cell.b").orElseThrow().typeContents()).isEqualTo("Real");
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        void parsesLazilyAndOnce() {
            DictionarySource source = mock(DictionarySource.class);
            when(source.read()).thenReturn("save_a.b\n _definition.id '_a.b'\n _alias.definition_id '_a_b'\nsave_\n");
            when(source.name()).thenReturn("mock");
            DictionaryParser lazy = new DictionaryParser(source);

            assertThat(lazy.isParsed()).isFalse();
            lazy.getCif2Field("_a_b");
            lazy.getCif1Field("_a.b");
            lazy.isKnownField("_a.b");

            assertThat(lazy.isParsed()).isTrue();
            verify(source, times(1)).read();
        }

        @Test
        void invalidateRereadsSource() {
            DictionarySource source = mock(DictionarySource.class);
            when(source.read()).thenReturn("save_a.b\n _definition.id '_a.b'\nsave_\n");
            when(source.name()).thenReturn("mock");
            DictionaryParser lazy = new DictionaryParser(source);

            lazy.parse();
            lazy.invalidate();
            assertThat(lazy.isParsed()).isFalse();
            lazy.parse();

            verify(source, times(2)).read();
        }

        @Test
        void missingFileFailsOnFirstUse(@TempDir Path tempDir) {
            Path missing = tempDir.resolve("absent.dic");
            DictionaryParser absent = new DictionaryParser(DictionarySource.fromPath(missing));

            assertThatThrownBy(absent::parse)
                    .isInstanceOf(DictionaryNotFoundException.class)
                    .hasMessageContaining("absent.dic")
                    .satisfies(e -> assertThat(((DictionaryNotFoundException) e).source())
                            .isEqualTo(missing.toString()));
        }

        @Test
        void missingClasspathResource() {
            DictionaryParser absent = new DictionaryParser(
                    DictionarySource.fromClasspath("no-such.dic", getClass().getClassLoader()));

            assertThatThrownBy(() -> absent.isKnownField("_x"))
                    .isInstanceOf(DictionaryNotFoundException.class)
                    .hasMessageContaining("no-such.dic");
        }
    }
}

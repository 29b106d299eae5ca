package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.cifxform.core.model.ExtensionMapping;
import io.cifxform.core.model.FieldStatus;
import io.cifxform.core.spi.FieldDictionary;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ExtensionOverlay")
class ExtensionOverlayTest {

    @Mock
    private FieldDictionary base;

    private ExtensionOverlay overlay;

    @BeforeEach
    void setUp() {
        ExtensionMappings table = new ExtensionMappings(List.of(
                new ExtensionMapping("_refine.diffraction_theory", "_refine_diffraction_theory"),
                new ExtensionMapping("_cell.length_a", "_cell_length_a_ext")));
        overlay = new ExtensionOverlay(base, table);

        when(base.getCif2Equivalent("_cell_length_a")).thenReturn(Optional.of("_cell.length_a"));
        when(base.getCif1Equivalent("_cell.length_a")).thenReturn(Optional.of("_cell_length_a"));
        when(base.getCif2Equivalent("_refine_diffraction_theory")).thenReturn(Optional.empty());
        when(base.getCif1Equivalent("_refine.diffraction_theory")).thenReturn(Optional.empty());
        when(base.isKnownField("_cell.length_a")).thenReturn(true);
    }

    @Test
    void officialMappingWins() {
        assertThat(overlay.getCif1Equivalent("_cell.length_a")).contains("_cell_length_a");
        assertThat(overlay.getCif2Equivalent("_cell_length_a")).contains("_cell.length_a");
    }

    @Test
    void extensionFillsTheGap() {
        assertThat(overlay.getCif1Equivalent("_refine.diffraction_theory")).contains("_refine_diffraction_theory");
        assertThat(overlay.getCif2Equivalent("_refine_diffraction_theory")).contains("_refine.diffraction_theory");
        assertThat(overlay.isKnownField("_refine.diffraction_theory")).isTrue();
    }

    @Test
    void fieldStatus() {
        assertThat(overlay.getFieldStatus("_cell.length_a")).isEqualTo(FieldStatus.OFFICIAL);
        assertThat(overlay.getFieldStatus("_refine.diffraction_theory")).isEqualTo(FieldStatus.CIF2_ONLY_EXTENSION);
        assertThat(overlay.getFieldStatus("_made.up")).isEqualTo(FieldStatus.UNKNOWN);
        assertThat(overlay.isCif2OnlyExtension("_cell.length_a")).isFalse();
        assertThat(overlay.isCif2OnlyExtension("_refine.diffraction_theory")).isTrue();
    }

    @Test
    void deprecationQueriesDelegate() {
        when(base.isFieldDeprecated("_old")).thenReturn(true);
        when(base.getReplacementField("_old")).thenReturn(Optional.of("_new"));

        assertThat(overlay.isFieldDeprecated("_old")).isTrue();
        assertThat(overlay.getReplacementField("_old")).contains("_new");
        verify(base, never()).isFieldDeprecated("_refine.diffraction_theory");
    }

    @Test
    void bundledOverlayOverRealParser() {
        ExtensionOverlay real = ExtensionOverlay.withBundledExtensions(
                new DictionaryParser(TestDictionaries.testDictionary()));

        assertThat(real.getCif1Equivalent("_cell.length_a")).contains("_cell_length_a");
        assertThat(real.getCif1Equivalent("_refine_ls.sample_thickness")).contains("_refine_ls_sample_thickness");
        assertThat(real.getFieldStatus("_refine_ls_sample_thickness")).isEqualTo(FieldStatus.CIF2_ONLY_EXTENSION);
        assertThat(real.extensions().size()).isEqualTo(25);
    }
}

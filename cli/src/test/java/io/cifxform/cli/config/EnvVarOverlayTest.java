package io.cifxform.cli.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Environment variables override YAML values; blank variables count as unset. */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private static Path fixture(String name) throws Exception {
        return Path.of(EnvVarOverlayTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Test
    @DisplayName("Env vars override every YAML key")
    void envOverridesYaml() throws Exception {
        Map<String, String> env = Map.of(
                "CIF_DICTIONARY", "/env/core.dic",
                "CIF_EXTENSIONS", "/env/ext.yaml",
                "CIF_PREFER_TRIPLE_QUOTES", "false",
                "CIF_REPORT_FORMAT", "text",
                "LOGGING_FORMAT", "text",
                "LOGGING_LEVEL", "warn");

        CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

        assertThat(config.dictionaryPath()).isEqualTo("/env/core.dic");
        assertThat(config.extensionsPath()).isEqualTo("/env/ext.yaml");
        assertThat(config.preferTripleQuotes()).isFalse();
        assertThat(config.reportFormat()).isEqualTo("text");
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
    }

    @Test
    @DisplayName("Blank env var does not override")
    void blankIsIgnored() throws Exception {
        Map<String, String> env = Map.of("CIF_DICTIONARY", "   ", "CIF_REPORT_FORMAT", "");

        CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

        assertThat(config.dictionaryPath()).isEqualTo("/opt/cif/cif_core.dic");
        assertThat(config.reportFormat()).isEqualTo("json");
    }

    @Test
    @DisplayName("Values are trimmed")
    void valuesAreTrimmed(@TempDir Path workingDir) {
        Map<String, String> env = Map.of("CIF_DICTIONARY", "  /trim/me.dic  ", "CIF_PREFER_TRIPLE_QUOTES", " TRUE ");

        CliConfig config = ConfigLoader.resolve(null, workingDir, env::get);

        assertThat(config.dictionaryPath()).isEqualTo("/trim/me.dic");
        assertThat(config.preferTripleQuotes()).isTrue();
    }
}

package io.jtv.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jtv.core.engine.EngineOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoaderTest")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        void minimalConfigKeepsDefaultsForUnsetKeys() throws Exception {
            CliConfig config = ConfigLoader.load(resource("config/minimal-config.yaml"), NO_ENV);

            assertThat(config.maxSteps()).isEqualTo(5000);
            assertThat(config.maxCallDepth()).isEqualTo(256);
            assertThat(config.integerBits()).isZero();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.trace()).isFalse();
        }

        @Test
        void fullConfigSetsEveryField() throws Exception {
            CliConfig config = ConfigLoader.load(resource("config/full-config.yaml"), NO_ENV);

            assertThat(config).isEqualTo(new CliConfig(250, 32, 16, "json", "INFO", true));
        }

        @Test
        void emptyFileMeansDefaults() throws IOException {
            Path empty = tempDir.resolve("empty.yaml");
            Files.writeString(empty, "");

            assertThat(ConfigLoader.load(empty, NO_ENV)).isEqualTo(CliConfig.builder().build());
        }

        @Test
        void engineOptionsReflectTheConfig() throws Exception {
            EngineOptions options =
                    ConfigLoader.load(resource("config/full-config.yaml"), NO_ENV).toEngineOptions();

            assertThat(options.limits().maxSteps()).isEqualTo(250);
            assertThat(options.limits().maxCallDepth()).isEqualTo(32);
            assertThat(options.numericPolicy().integerBits()).isEqualTo(16);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void missingFileIsReported() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        void malformedYamlIsReported() throws IOException {
            Path broken = tempDir.resolve("broken.yaml");
            Files.writeString(broken, "limits: [unclosed");

            assertThatThrownBy(() -> ConfigLoader.load(broken, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration");
        }

        @Test
        void unknownLoggingFormatIsRejected() throws Exception {
            Path path = resource("config/invalid-format.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid configuration")
                    .hasMessageContaining("xml");
        }

        @Test
        void nonPositiveLimitIsRejected() throws Exception {
            Path path = resource("config/invalid-limits.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid configuration");
        }

        @Test
        void oneBitIntegersAreRejected() {
            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("JTV_INTEGER_BITS", "1")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("integerBits");
        }
    }

    @Nested
    @DisplayName("--config resolution")
    class ConfigPathResolution {

        @Test
        void absentOptionMeansNoFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"run", "prog.yaml"})).isEmpty();
        }

        @Test
        void optionValueIsThePath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"run", "--config", "jtv.yaml", "prog.yaml"}))
                    .contains(Path.of("jtv.yaml"));
        }

        @Test
        void optionWithoutValueIsAnError() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"run", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config requires a file path");
        }
    }
}

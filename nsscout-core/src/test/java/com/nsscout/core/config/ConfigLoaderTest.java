package com.nsscout.core.config;

import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConditionalMode;
import com.nsscout.core.reader.ReaderConfig;
import com.nsscout.core.scanner.ScanContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader} and {@link ProjectConfig}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("nsscout.yaml");
        Files.writeString(configFile, """
            classpath:
              - src
              - lib/dep.jar
            prefix: "my.app"
            lenient: false
            extraction: all
            reader:
              conditionals: preserve
              features: [cljs, ":bb"]
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.classpath()).containsExactly("src", "lib/dep.jar");
        assertThat(config.classpathEntries()).containsExactly(Path.of("src"), Path.of("lib/dep.jar"));
        assertThat(config.prefix()).isEqualTo("my.app");

        ScanContext context = config.toScanContext(ReaderConfig.defaults());
        assertThat(context.prefix()).isEqualTo("my.app");
        assertThat(context.lenient()).isFalse();
        assertThat(context.extractionMode()).isEqualTo(ExtractionMode.ALL);
        assertThat(context.readerConfig().conditionalMode()).isEqualTo(ReaderConditionalMode.PRESERVE);
        assertThat(context.readerConfig().features()).containsExactlyInAnyOrder("cljs", "bb");
    }

    @Test
    void load_minimalYaml_keepsDefaultsForUnsetFields() throws IOException {
        Path configFile = tempDir.resolve("nsscout.yaml");
        Files.writeString(configFile, """
            prefix: lib
            unknownField: ignored
            """);

        ScanContext context = ConfigLoader.load(configFile).toScanContext(ReaderConfig.defaults());

        assertThat(context).isEqualTo(ScanContext.defaults(ReaderConfig.defaults()).withPrefix("lib"));
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.hasClasspath()).isFalse();
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("nsscout.yaml");
        Files.writeString(configFile, "classpath: [unclosed\n  prefix: : :");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve("nsscout.yaml"), "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void toScanContext_unknownExtraction_throws() {
        ProjectConfig config = new ProjectConfig(null, null, null, "some", null);

        assertThatThrownBy(() -> config.toScanContext(ReaderConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("some");
    }

    @Test
    void toReaderConfig_noReaderSection_returnsBase() {
        ReaderConfig base = ReaderConfig.defaults().withConditionalMode(ReaderConditionalMode.DISALLOW);

        assertThat(ProjectConfig.defaults().toReaderConfig(base)).isSameAs(base);
    }
}

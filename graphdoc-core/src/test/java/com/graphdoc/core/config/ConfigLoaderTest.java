package com.graphdoc.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        // Given
        Path configFile = tempDir.resolve("graphdoc.yaml");
        Files.writeString(configFile, """
            source:
              root: ./models
              scriptFolder: Skripte
            output:
              directory: ./wiki
              setupFile: ../setup.org
            rendering:
              withCodeBlocks: false
              trueValue: "x"
            crawler:
              threads: 2
              excludedNames: [attic]
            unknownSection: ignored
            """);

        // When
        GraphDocConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.source().root()).isEqualTo("./models");
        assertThat(config.source().scriptFolder()).isEqualTo("Skripte");
        assertThat(config.source().packageFolder()).isEqualTo("Packages");
        assertThat(config.output().directory()).isEqualTo("./wiki");
        assertThat(config.output().setupFile()).isEqualTo("../setup.org");
        assertThat(config.rendering().withCodeBlocks()).isFalse();
        assertThat(config.rendering().trueValue()).isEqualTo("x");
        assertThat(config.rendering().falseValue()).isEqualTo("No");
        assertThat(config.rendering().placeholder()).isEqualTo(GraphDocConfig.RenderingConfig.DEFAULT_PLACEHOLDER);
        assertThat(config.crawler().threads()).isEqualTo(2);
        assertThat(config.crawler().excludedNames()).containsExactly("attic");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        GraphDocConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(GraphDocConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("graphdoc.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(GraphDocConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("graphdoc.yaml");
        Files.writeString(configFile, "source: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(GraphDocConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(GraphDocConfig.defaults());
    }

    @Test
    void withRoots_overridesOnlyGivenRoots() {
        GraphDocConfig config = GraphDocConfig.defaults().withRoots("/models", null);

        assertThat(config.source().root()).isEqualTo("/models");
        assertThat(config.source().scriptFolder()).isEqualTo("Scripts");
        assertThat(config.output().directory()).isEqualTo("./docs/org");
    }
}

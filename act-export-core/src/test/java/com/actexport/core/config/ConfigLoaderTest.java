package com.actexport.core.config;

import com.actexport.core.render.RenderOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("actexport.yaml");
        Files.writeString(configFile, """
            document:
              title: "АКТ ПРОВЕРКИ"
              captions: false

            text:
              lineWidth: 100
              indentWidth: 4

            markdown:
              maxHeadingLevel: 4

            output:
              directory: "./out"
              filePrefix: "audit"
              formats:
                - markdown
              writers:
                - console
              settings:
                console.colors: "false"
            """);

        ExportConfig config = ConfigLoader.load(configFile);

        assertThat(config.document().title()).isEqualTo("АКТ ПРОВЕРКИ");
        assertThat(config.document().captions()).isFalse();
        assertThat(config.text().lineWidth()).isEqualTo(100);
        assertThat(config.markdown().maxHeadingLevel()).isEqualTo(4);
        assertThat(config.docx().maxHeadingLevel()).isNull();
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().filePrefix()).isEqualTo("audit");
        assertThat(config.output().formats()).containsExactly("markdown");
        assertThat(config.output().writers()).containsExactly("console");
        assertThat(config.output().settings()).containsEntry("console.colors", "false");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("actexport.yaml");
        Files.writeString(configFile, """
            text:
              lineWidth: 60
            """);

        ExportConfig config = ConfigLoader.load(configFile);
        RenderOptions options = config.toRenderOptions();

        assertThat(options.lineWidth()).isEqualTo(60);
        assertThat(options.title()).isEqualTo("АКТ");
        assertThat(options.captions()).isTrue();
        assertThat(config.output().formats()).containsExactly("text", "markdown", "docx");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("actexport.yaml");
        Files.writeString(configFile, """
            pdf:
              enabled: true
            document:
              title: "Отчёт"
              watermark: "draft"
            """);

        ExportConfig config = ConfigLoader.load(configFile);

        assertThat(config.document().title()).isEqualTo("Отчёт");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        ExportConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ExportConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(ExportConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("actexport.yaml");
        Files.writeString(configFile, """
            text:
              lineWidth: [not, a, number
            """);

        ExportConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ExportConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ExportConfig.defaults());
    }
}

package com.actexport.core.config;

import com.actexport.core.render.RenderOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExportConfig}.
 */
class ExportConfigTest {

    @Test
    void defaults_toRenderOptions_matchesRenderDefaults() {
        assertThat(ExportConfig.defaults().toRenderOptions()).isEqualTo(RenderOptions.defaults());
    }

    @Test
    void toRenderOptions_outOfRangeValues_areClamped() {
        // Given
        ExportConfig config = new ExportConfig(
            new ExportConfig.DocumentConfig(null, null, 200),
            new ExportConfig.TextConfig(10, null),
            new ExportConfig.MarkdownConfig(9),
            new ExportConfig.DocxConfig(0),
            null);

        // When
        RenderOptions options = config.toRenderOptions();

        // Then
        assertThat(options.defaultFontSize()).isEqualTo(72);
        assertThat(options.lineWidth()).isEqualTo(20);
        assertThat(options.markdownMaxHeadingLevel()).isEqualTo(6);
        assertThat(options.docxMaxHeadingLevel()).isEqualTo(1);
    }

    @Test
    void outputConfig_blankValues_fallBackToDefaults() {
        ExportConfig.OutputConfig output = new ExportConfig.OutputConfig(" ", "", null, List.of(), null);

        assertThat(output.directory()).isEqualTo(ExportConfig.OutputConfig.DEFAULT_DIRECTORY);
        assertThat(output.filePrefix()).isEqualTo("act");
        assertThat(output.formats()).isEqualTo(ExportConfig.OutputConfig.DEFAULT_FORMATS);
        assertThat(output.writers()).containsExactly("filesystem");
        assertThat(output.settings()).isEmpty();
    }
}

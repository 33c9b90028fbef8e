package com.actexport.core.output;

import com.actexport.core.ActFixtures;
import com.actexport.core.render.ActRenderer;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.render.impl.MarkdownRenderer;
import com.actexport.core.render.impl.PlainTextRenderer;
import com.actexport.core.tree.SubtreeOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ActExporter}.
 */
class ActExporterTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    private ActExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new ActExporter(new ExportFileNames("act", FIXED_CLOCK));
    }

    @Test
    void constructor_discoversAllRenderers() {
        assertThat(exporter.renderers())
            .extracting(ActRenderer::getId)
            .containsExactlyInAnyOrder("text", "markdown", "docx");
    }

    @Test
    void renderFull_markdown_namesFileWithTimestamp() {
        // When
        ExportedFile file = exporter.renderFull("markdown", ActFixtures.act(), RenderOptions.defaults());

        // Then
        assertThat(file.relativePath()).isEqualTo("act_20240101_120000.md");
        assertThat(file.contentType()).isEqualTo("text/markdown");
        assertThat(file.contentAsString()).startsWith("# АКТ");
    }

    @Test
    void renderFull_docx_isBinary() {
        // When
        ExportedFile file = exporter.renderFull("DOCX", ActFixtures.act(), null);

        // Then
        assertThat(file.relativePath()).isEqualTo("act_20240101_120000.docx");
        assertThat(file.isText()).isFalse();
        assertThat(file.size()).isPositive();
        // DOCX is a zip archive
        assertThat(file.content()[0]).isEqualTo((byte) 'P');
        assertThat(file.content()[1]).isEqualTo((byte) 'K');
    }

    @Test
    void renderFull_unknownFormat_throwsException() {
        assertThatThrownBy(() -> exporter.renderFull("pdf", ActFixtures.act(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unsupported export format: pdf");
    }

    @Test
    void renderSubtree_includesNumberInFileName() {
        // When
        Optional<ExportedFile> file = exporter.renderSubtree("text", ActFixtures.act(), "5.1.",
            SubtreeOptions.nodeOnly(), null);

        // Then
        assertThat(file).isPresent();
        assertThat(file.get().relativePath()).isEqualTo("act_5.1_20240101_120000.txt");
        assertThat(file.get().contentAsString()).isEqualTo("5.1. Проверка\n-------------\n");
    }

    @Test
    void renderSubtrees_missingNumber_mapsToEmpty() {
        // When
        Map<String, Optional<ExportedFile>> files = exporter.renderSubtrees("markdown", ActFixtures.act(),
            List.of("5.2", "7"), SubtreeOptions.full(), null);

        // Then
        assertThat(files).containsOnlyKeys("5.2", "7");
        assertThat(files.get("5.2")).isPresent();
        assertThat(files.get("7")).isEmpty();
    }

    @Test
    void constructor_duplicateIds_firstRendererWins() {
        // Given
        MarkdownRenderer first = new MarkdownRenderer();
        ActExporter custom = new ActExporter(List.of(first, new MarkdownRenderer(), new PlainTextRenderer()),
            new ExportFileNames());

        // Then
        assertThat(custom.renderers()).hasSize(2);
        assertThat(custom.renderer("markdown")).isSameAs(first);
    }
}

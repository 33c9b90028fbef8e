package com.actexport.core.render;

import com.actexport.core.model.ActNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeContext} and {@link RenderOptions}.
 */
class NodeContextTest {

    @Test
    void caption_withNumber_appendsItemReference() {
        assertThat(new NodeContext(2, "5.1").caption(ActNode.table("n", "t"), "Таблица"))
            .isEqualTo("Таблица (пункт 5.1)");
    }

    @Test
    void caption_customLabel_replacesDefault() {
        ActNode node = ActNode.table("n", "t").withCustomLabel(" Реестр ");

        assertThat(new NodeContext(1, null).caption(node, "Таблица")).isEqualTo("Реестр");
        assertThat(new NodeContext(1, "2").caption(node, "Таблица")).isEqualTo("Реестр (пункт 2)");
    }

    @Test
    void renderOptions_outOfRangeValues_areClamped() {
        RenderOptions options = new RenderOptions(" ", 12, 0, 5, 20, 100, false);

        assertThat(options.title()).isEqualTo("АКТ");
        assertThat(options.markdownMaxHeadingLevel()).isEqualTo(6);
        assertThat(options.docxMaxHeadingLevel()).isEqualTo(1);
        assertThat(options.lineWidth()).isEqualTo(20);
        assertThat(options.indentWidth()).isEqualTo(8);
        assertThat(options.defaultFontSize()).isEqualTo(72);
        assertThat(options.withCaptions(true).captions()).isTrue();
    }
}

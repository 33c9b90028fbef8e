package com.actexport.core.tree;

import com.actexport.core.ActFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TreeOutline}.
 */
class TreeOutlineTest {

    @Test
    void render_itemsOnly_indentsByLevel() {
        String outline = TreeOutline.render(ActFixtures.tree(), false);

        assertThat(outline).isEqualTo("""
            1. Общие сведения
            5. Результаты
              5.1. Проверка
                5.1.1. Деталь
              5.2. Пусто""");
    }

    @Test
    void render_withElements_listsMarkersAndTotals() {
        String outline = TreeOutline.render(ActFixtures.tree(), true);

        assertThat(outline).isEqualTo("""
            1. Общие сведения
              [Текстовый блок]
            5. Результаты
              5.1. Проверка
                [Таблица]
                [Нарушение]
                5.1.1. Деталь
                  [Таблица]
              5.2. Пусто

            Всего таблиц: 2
            Всего текстовых блоков: 1
            Всего нарушений: 1""");
    }
}

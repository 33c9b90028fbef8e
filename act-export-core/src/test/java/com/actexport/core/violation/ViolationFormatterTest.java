package com.actexport.core.violation;

import com.actexport.core.model.AdditionalContent;
import com.actexport.core.model.ContentItem;
import com.actexport.core.model.DescriptionList;
import com.actexport.core.model.OptionalField;
import com.actexport.core.model.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ViolationFormatter}.
 */
class ViolationFormatterTest {

    @Test
    void format_onlyReasonsEnabled_returnsSingleEntry() {
        // Given
        Violation violation = new Violation("v", "", "", null, null, OptionalField.of("X"), null, null, null);

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.kind()).isEqualTo(ViolationEntry.Kind.FIELD);
            assertThat(entry.label()).isEqualTo("Причины");
            assertThat(entry.text()).isEqualTo("X");
        });
    }

    @Test
    void format_optionalFieldsTriState_omitsDisabledAndBlank() {
        // Given
        Violation violation = new Violation("v", "Нарушен порядок", "Установлен факт", null, null,
            new OptionalField(false, "hidden"),
            new OptionalField(true, "   "),
            OptionalField.of(" Иванов И.И. "),
            null);

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).extracting(ViolationEntry::label)
            .containsExactly("Нарушено", "Установлено", "Ответственные");
        assertThat(entries.get(2).text()).isEqualTo("Иванов И.И.");
    }

    @Test
    void format_fullViolation_keepsSectionOrder() {
        // Given
        Violation violation = new Violation("v", "A", "B",
            new DescriptionList(true, List.of("первое", " ", "второе")),
            new AdditionalContent(true, List.of(ContentItem.freeText("текст", 3), ContentItem.caseItem("кейс", 1))),
            OptionalField.of("R"), OptionalField.of("C"), OptionalField.of("P"), OptionalField.of("Rec"));

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).extracting(ViolationEntry::label).containsExactly(
            "Нарушено", "Установлено", "Описание", "Кейс 1", "", "Причины", "Последствия",
            "Ответственные", "Рекомендации");
        assertThat(entries.get(2).items()).containsExactly("первое", "второе");
    }

    @Test
    void format_additionalContent_sortsByOrderStably() {
        // Given
        Violation violation = new Violation("v", "", "", null,
            new AdditionalContent(true, List.of(
                ContentItem.caseItem("второй", 2),
                ContentItem.image("photo.png", "Фото", 1),
                ContentItem.caseItem("первый", 0),
                ContentItem.freeText("тот же порядок", 2))),
            null, null, null, null);

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).extracting(ViolationEntry::kind).containsExactly(
            ViolationEntry.Kind.CASE, ViolationEntry.Kind.IMAGE, ViolationEntry.Kind.CASE, ViolationEntry.Kind.FREE_TEXT);
        assertThat(entries.get(0).label()).isEqualTo("Кейс 1");
        assertThat(entries.get(0).text()).isEqualTo("«первый»");
        assertThat(entries.get(1).imageReference()).isEqualTo("photo.png - Фото");
        assertThat(entries.get(2).text()).isEqualTo("«второй»");
    }

    @Test
    void format_casesSeparatedByOtherContent_restartNumbering() {
        // Given
        Violation violation = new Violation("v", "", "", null,
            new AdditionalContent(true, List.of(
                ContentItem.caseItem("первый", 0),
                ContentItem.caseItem("второй", 1),
                ContentItem.image("photo.png", "Фото", 2),
                ContentItem.caseItem("третий", 3),
                ContentItem.freeText("пояснение", 4),
                ContentItem.caseItem("четвертый", 5),
                ContentItem.caseItem("пятый", 6))),
            null, null, null, null);

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).filteredOn(entry -> entry.kind() == ViolationEntry.Kind.CASE)
            .extracting(ViolationEntry::label)
            .containsExactly("Кейс 1", "Кейс 2", "Кейс 1", "Кейс 1", "Кейс 2");
    }

    @Test
    void format_blankItemBetweenCases_keepsNumbering() {
        // Given
        Violation violation = new Violation("v", "", "", null,
            new AdditionalContent(true, List.of(
                ContentItem.caseItem("первый", 0),
                ContentItem.freeText("  ", 1),
                ContentItem.caseItem("второй", 2))),
            null, null, null, null);

        // When
        List<ViolationEntry> entries = ViolationFormatter.format(violation);

        // Then
        assertThat(entries).extracting(ViolationEntry::label).containsExactly("Кейс 1", "Кейс 2");
    }

    @Test
    void format_disabledCollections_areOmitted() {
        Violation violation = new Violation("v", "", "",
            new DescriptionList(false, List.of("скрыто")),
            new AdditionalContent(false, List.of(ContentItem.caseItem("скрыто", 0))),
            null, null, null, null);

        assertThat(ViolationFormatter.format(violation)).isEmpty();
    }

    @Test
    void resolve_returnsContentOnlyWhenPresent() {
        assertThat(ViolationFormatter.resolve(OptionalField.of(" x "))).isEqualTo("x");
        assertThat(ViolationFormatter.resolve(new OptionalField(true, ""))).isNull();
        assertThat(ViolationFormatter.resolve(OptionalField.disabled())).isNull();
        assertThat(ViolationFormatter.resolve(null)).isNull();
    }

    @Test
    void imageReference_withoutFilename_fallsBackToUrlOrCaption() {
        ViolationEntry withUrl = new ViolationEntry(ViolationEntry.Kind.IMAGE, "Изображение", "Фото",
            null, "", "http://host/img.png");
        ViolationEntry captionOnly = new ViolationEntry(ViolationEntry.Kind.IMAGE, "Изображение", "Фото",
            null, "", "");

        assertThat(withUrl.imageReference()).isEqualTo("http://host/img.png - Фото");
        assertThat(captionOnly.imageReference()).isEqualTo("Фото");
    }

    @Test
    void format_null_throwsException() {
        assertThatThrownBy(() -> ViolationFormatter.format(null)).isInstanceOf(NullPointerException.class);
    }
}

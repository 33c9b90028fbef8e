package com.actexport.core.violation;

import com.actexport.core.model.ContentItem;
import com.actexport.core.model.OptionalField;
import com.actexport.core.model.Violation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link Violation} into an ordered list of {@link ViolationEntry} sections.
 *
 * <p>Section order: {@code Нарушено}, {@code Установлено}, the description list, the
 * additional content items sorted by their {@code order} (ties keep stored order),
 * then the optional fields {@code Причины}, {@code Последствия}, {@code Ответственные},
 * {@code Рекомендации}.
 *
 * <p>Cases are numbered from 1 within each run of consecutive cases; an emitted image or
 * free-text item starts a new run.
 *
 * <p>Optional fields are tri-state: disabled fields are omitted, enabled but blank
 * fields are omitted, enabled fields with content are emitted under their label. The
 * description list and the additional content follow the same rule as a whole.
 */
public final class ViolationFormatter {

    public static final String VIOLATED = "Нарушено";
    public static final String ESTABLISHED = "Установлено";
    public static final String DESCRIPTION = "Описание";
    public static final String CASE = "Кейс";
    public static final String IMAGE = "Изображение";
    public static final String REASONS = "Причины";
    public static final String CONSEQUENCES = "Последствия";
    public static final String RESPONSIBLE = "Ответственные";
    public static final String RECOMMENDATIONS = "Рекомендации";

    private ViolationFormatter() {
    }

    /**
     * Formats a violation.
     *
     * @param violation violation to format
     * @return sections in display order, empty when nothing is filled in
     */
    public static List<ViolationEntry> format(Violation violation) {
        Objects.requireNonNull(violation, "violation must not be null");
        List<ViolationEntry> entries = new ArrayList<>();

        if (!violation.violated().isBlank()) {
            entries.add(ViolationEntry.field(VIOLATED, violation.violated().trim()));
        }
        if (!violation.established().isBlank()) {
            entries.add(ViolationEntry.field(ESTABLISHED, violation.established().trim()));
        }

        if (violation.descriptionList().enabled()) {
            List<String> items = violation.descriptionList().items().stream()
                .filter(item -> !item.isBlank())
                .map(String::trim)
                .toList();
            if (!items.isEmpty()) {
                entries.add(ViolationEntry.list(DESCRIPTION, items));
            }
        }

        if (violation.additionalContent().enabled()) {
            addContentItems(violation.additionalContent().items(), entries);
        }

        addOptional(REASONS, violation.reasons(), entries);
        addOptional(CONSEQUENCES, violation.consequences(), entries);
        addOptional(RESPONSIBLE, violation.responsible(), entries);
        addOptional(RECOMMENDATIONS, violation.recommendations(), entries);
        return entries;
    }

    /**
     * Returns the content of an optional field if it should be rendered.
     *
     * @param field tri-state field
     * @return trimmed content, or null when the field is disabled or blank
     */
    public static String resolve(OptionalField field) {
        return field != null && field.isPresent() ? field.content().trim() : null;
    }

    private static void addOptional(String label, OptionalField field, List<ViolationEntry> entries) {
        String content = resolve(field);
        if (content != null) {
            entries.add(ViolationEntry.field(label, content));
        }
    }

    private static void addContentItems(List<ContentItem> items, List<ViolationEntry> entries) {
        // List.sort is stable, ties keep stored order
        List<ContentItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt(ContentItem::order));

        int caseNumber = 0;
        for (ContentItem item : sorted) {
            switch (item.type()) {
                case CASE -> {
                    if (!item.content().isBlank()) {
                        caseNumber++;
                        entries.add(ViolationEntry.caseEntry(CASE + " " + caseNumber,
                            "«" + item.content().trim() + "»"));
                    }
                }
                case IMAGE -> {
                    if (!item.filename().isBlank() || !item.url().isBlank() || !item.caption().isBlank()) {
                        entries.add(ViolationEntry.image(IMAGE, item.caption().trim(),
                            item.filename().trim(), item.url().trim()));
                        caseNumber = 0;
                    }
                }
                case FREE_TEXT -> {
                    if (!item.content().isBlank()) {
                        entries.add(ViolationEntry.freeText(item.content().trim()));
                        caseNumber = 0;
                    }
                }
            }
        }
    }
}

package com.actexport.core.model;

import java.util.Objects;

/**
 * Violation satellite entity.
 *
 * @param id violation id
 * @param violated what was violated
 * @param established what was established
 * @param descriptionList optional description lines
 * @param additionalContent optional cases, images and free text
 * @param reasons optional reasons
 * @param consequences optional consequences
 * @param responsible optional responsible persons
 * @param recommendations optional recommendations
 */
public record Violation(
    String id,
    String violated,
    String established,
    DescriptionList descriptionList,
    AdditionalContent additionalContent,
    OptionalField reasons,
    OptionalField consequences,
    OptionalField responsible,
    OptionalField recommendations
) {
    /**
     * Compact constructor replacing absent parts with disabled defaults.
     */
    public Violation {
        Objects.requireNonNull(id, "id must not be null");
        violated = violated == null ? "" : violated;
        established = established == null ? "" : established;
        descriptionList = descriptionList == null ? DescriptionList.disabled() : descriptionList;
        additionalContent = additionalContent == null ? AdditionalContent.disabled() : additionalContent;
        reasons = reasons == null ? OptionalField.disabled() : reasons;
        consequences = consequences == null ? OptionalField.disabled() : consequences;
        responsible = responsible == null ? OptionalField.disabled() : responsible;
        recommendations = recommendations == null ? OptionalField.disabled() : recommendations;
    }

    /**
     * Creates a violation with only the two main texts set.
     *
     * @param id violation id
     * @param violated what was violated
     * @param established what was established
     * @return violation with every optional part disabled
     */
    public static Violation of(String id, String violated, String established) {
        return new Violation(id, violated, established, null, null, null, null, null, null);
    }
}

package com.actexport.core.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that external references (for example directives attached to act items) point at
 * existing items of an allowed top-level branch.
 *
 * <p>Problems are returned, not thrown; the caller decides whether they are fatal.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Set<String> numbers = ActTree.collectAllItemNumbers(tree);
 * List<ReferenceProblem> problems =
 *     new ItemReferenceValidator("5.").validate(List.of("5.1", "3.2"), numbers);
 * }</pre>
 */
public class ItemReferenceValidator {

    private static final Logger log = LoggerFactory.getLogger(ItemReferenceValidator.class);

    private final String requiredPrefix;

    /**
     * Creates a validator.
     *
     * @param requiredPrefix prefix every reference must start with, such as {@code "5."};
     *                       null or blank disables the branch check
     */
    public ItemReferenceValidator(String requiredPrefix) {
        this.requiredPrefix = requiredPrefix == null ? "" : requiredPrefix.trim();
    }

    /**
     * Validates references against the numbers present in a tree.
     *
     * @param references referenced item numbers
     * @param existingNumbers numbers from {@link ActTree#collectAllItemNumbers}
     * @return problems in reference order, empty if all references are valid
     */
    public List<ReferenceProblem> validate(Collection<String> references, Set<String> existingNumbers) {
        Objects.requireNonNull(references, "references must not be null");
        Objects.requireNonNull(existingNumbers, "existingNumbers must not be null");

        Set<String> normalized = existingNumbers.stream()
            .map(ActTree::normalizeNumber)
            .collect(Collectors.toSet());

        List<ReferenceProblem> problems = new ArrayList<>();
        for (String reference : references) {
            String number = ActTree.normalizeNumber(reference);
            if (!requiredPrefix.isEmpty() && !number.startsWith(requiredPrefix)) {
                problems.add(new ReferenceProblem(reference, ReferenceProblem.Kind.OUTSIDE_BRANCH,
                    "Reference '" + reference + "' must point into section " + requiredPrefix));
            } else if (!normalized.contains(number)) {
                problems.add(new ReferenceProblem(reference, ReferenceProblem.Kind.MISSING,
                    "Reference '" + reference + "' points at a missing item"));
            }
        }
        log.debug("Validated {} references, {} problem(s)", references.size(), problems.size());
        return problems;
    }
}

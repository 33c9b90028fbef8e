package com.actexport.core.tree;

import com.actexport.core.grid.GridProblem;
import com.actexport.core.grid.GridValidator;
import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Collects every consistency problem of an act snapshot in one pass.
 *
 * <p>Checks performed:
 * <ul>
 *   <li>non-item nodes whose reference is unset or points at a missing satellite entity</li>
 *   <li>table grid geometry (see {@link GridValidator})</li>
 *   <li>item numbers used by more than one item</li>
 *   <li>optional cross-references (see {@link ItemReferenceValidator})</li>
 * </ul>
 *
 * <p>Rendering tolerates all of these; the validator only reports them.
 */
public class ActDataValidator {

    private static final Logger log = LoggerFactory.getLogger(ActDataValidator.class);

    /**
     * Validates a snapshot without cross-references.
     *
     * @param data snapshot
     * @return problems, errors before warnings within each check
     */
    public List<DataProblem> validate(ActData data) {
        return validate(data, List.of(), null);
    }

    /**
     * Validates a snapshot and a set of item references.
     *
     * @param data snapshot
     * @param references item numbers referenced from outside the tree
     * @param requiredPrefix branch the references must point into, null to skip the branch check
     * @return problems in check order
     */
    public List<DataProblem> validate(ActData data, Collection<String> references, String requiredPrefix) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(references, "references must not be null");

        List<DataProblem> problems = new ArrayList<>();
        checkReferences(data.tree(), data, problems);
        checkTables(data, problems);

        for (String duplicate : ActTree.findDuplicateNumbers(data.tree())) {
            problems.add(DataProblem.warning("item " + duplicate,
                "number is used by more than one item; the first one wins"));
        }

        if (!references.isEmpty()) {
            List<ReferenceProblem> referenceProblems = new ItemReferenceValidator(requiredPrefix)
                .validate(references, ActTree.collectAllItemNumbers(data.tree()));
            for (ReferenceProblem problem : referenceProblems) {
                problems.add(DataProblem.error("reference " + problem.reference(), problem.message()));
            }
        }

        log.debug("Validation finished with {} problem(s)", problems.size());
        return problems;
    }

    private void checkReferences(ActNode node, ActData data, List<DataProblem> problems) {
        if (!node.isItem()) {
            String reference = node.satelliteId();
            String location = "node " + node.id();
            if (reference == null || reference.isBlank()) {
                problems.add(DataProblem.error(location,
                    node.type().wireName() + " node has no " + node.type().wireName() + " reference"));
            } else if (!satelliteExists(node, reference, data)) {
                problems.add(DataProblem.error(location,
                    "references missing " + node.type().wireName() + " '" + reference + "'"));
            }
        }
        for (ActNode child : node.children()) {
            checkReferences(child, data, problems);
        }
    }

    private boolean satelliteExists(ActNode node, String reference, ActData data) {
        return switch (node.type()) {
            case ITEM -> true;
            case TABLE -> data.table(reference) != null;
            case TEXTBLOCK -> data.textBlock(reference) != null;
            case VIOLATION -> data.violation(reference) != null;
        };
    }

    private void checkTables(ActData data, List<DataProblem> problems) {
        data.tables().values().stream()
            .sorted(Comparator.comparing(ActTable::id))
            .forEach(table -> addGridProblems(table, problems));
    }

    private void addGridProblems(ActTable table, List<DataProblem> problems) {
        for (GridProblem problem : GridValidator.validate(table)) {
            problems.add(DataProblem.error("table " + table.id(), problem.toString()));
        }
    }
}

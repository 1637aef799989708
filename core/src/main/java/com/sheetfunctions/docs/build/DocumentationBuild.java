package com.sheetfunctions.docs.build;

import com.sheetfunctions.docs.graph.DependencyGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Result of a successful documentation build. Formulas are ordered by name, ignoring case, which is
 * the order the renderer lists them in.
 */
public final class DocumentationBuild {
    private static final Comparator<ExpandedFormula> BY_NAME =
            Comparator.comparing(ExpandedFormula::getName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(ExpandedFormula::getName);

    private final List<ExpandedFormula> formulas;
    private final DependencyGraph graph;
    private final List<BuildMessage> messages;
    private final int expansionCount;

    DocumentationBuild(
            List<ExpandedFormula> formulas, DependencyGraph graph, List<BuildMessage> messages, int expansionCount) {
        List<ExpandedFormula> sorted = new ArrayList<>(formulas);
        sorted.sort(BY_NAME);
        this.formulas = List.copyOf(sorted);
        this.graph = graph;
        this.messages = List.copyOf(messages);
        this.expansionCount = expansionCount;
    }

    public List<ExpandedFormula> getFormulas() {
        return formulas;
    }

    public Optional<ExpandedFormula> find(String name) {
        for (ExpandedFormula formula : formulas) {
            if (formula.getName().equals(name)) {
                return Optional.of(formula);
            }
        }
        return Optional.empty();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /** INFO and WARNING messages; a build with errors never produces a result. */
    public List<BuildMessage> getMessages() {
        return messages;
    }

    /** Number of formulas expanded, each counted once. */
    public int getExpansionCount() {
        return expansionCount;
    }
}

package com.sheetfunctions.docs.build;

import com.sheetfunctions.docs.catalog.FormulaDefinition;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/** Build output for one named function, consumed by the document renderer. */
public final class ExpandedFormula {
    private final FormulaDefinition definition;
    private final SortedSet<String> dependencies;
    private final String inlinedText;
    private final String expandedText;

    public ExpandedFormula(
            FormulaDefinition definition, SortedSet<String> dependencies, String inlinedText, String expandedText) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
        this.inlinedText = Objects.requireNonNull(inlinedText, "inlinedText");
        this.expandedText = Objects.requireNonNull(expandedText, "expandedText");
    }

    public String getName() {
        return definition.getName();
    }

    public FormulaDefinition getDefinition() {
        return definition;
    }

    /** Catalog functions called directly from the body. */
    public SortedSet<String> getDependencies() {
        return dependencies;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /** Inlined text as cached during expansion, never with a leading {@code =}. */
    public String getInlinedText() {
        return inlinedText;
    }

    /** Text to publish, after the leading {@code =} policy. */
    public String getExpandedText() {
        return expandedText;
    }

    @Override
    public String toString() {
        return "ExpandedFormula[" + getName() + " -> " + dependencies + "]";
    }
}

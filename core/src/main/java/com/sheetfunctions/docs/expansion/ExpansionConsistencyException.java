package com.sheetfunctions.docs.expansion;

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when a formula that calls catalog functions comes out of expansion unchanged. That can
 * only happen when a call was found but not replaced, so the build must stop instead of publishing
 * unexpanded text.
 */
public final class ExpansionConsistencyException extends ExpansionException {
    private static final int EXCERPT_LENGTH = 100;

    private final String formulaName;
    private final Set<String> dependencies;

    public ExpansionConsistencyException(String formulaName, Set<String> dependencies, String body) {
        super(
                formulaName
                        + ": calls to "
                        + String.join(", ", new TreeSet<>(dependencies))
                        + " were not expanded (body: "
                        + excerpt(body)
                        + ")");
        this.formulaName = formulaName;
        this.dependencies = Set.copyOf(dependencies);
    }

    public String getFormulaName() {
        return formulaName;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    private static String excerpt(String body) {
        if (body.length() <= EXCERPT_LENGTH) {
            return body;
        }
        return body.substring(0, EXCERPT_LENGTH) + "...";
    }
}

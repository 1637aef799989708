package com.sheetfunctions.docs.graph;

import java.util.ArrayList;
import java.util.List;

/** Raised when the catalog's call graph contains at least one cycle. */
public final class CircularDependencyException extends Exception {
    private final List<List<String>> cycles;

    public CircularDependencyException(List<List<String>> cycles) {
        super(describe(cycles));
        List<List<String>> copy = new ArrayList<>(cycles.size());
        for (List<String> cycle : cycles) {
            copy.add(List.copyOf(cycle));
        }
        this.cycles = List.copyOf(copy);
    }

    /** Each cycle as an ordered path whose last element repeats the first. */
    public List<List<String>> getCycles() {
        return cycles;
    }

    private static String describe(List<List<String>> cycles) {
        StringBuilder message = new StringBuilder("Circular dependencies detected:");
        for (List<String> cycle : cycles) {
            message.append(System.lineSeparator()).append("  - ").append(CycleDetector.describe(cycle));
        }
        return message.toString();
    }
}

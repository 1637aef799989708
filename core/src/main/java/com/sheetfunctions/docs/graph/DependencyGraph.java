package com.sheetfunctions.docs.graph;

import com.sheetfunctions.docs.expansion.CallExtractor;
import com.sheetfunctions.docs.parser.ParsedFormula;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Directed "calls" graph over the catalog. Every catalog name is a node, and edges only point at
 * catalog names: calls to built-in functions are not tracked.
 */
public final class DependencyGraph {
    private final Map<String, SortedSet<String>> edges;

    public DependencyGraph(Map<String, ? extends Collection<String>> edges) {
        Objects.requireNonNull(edges, "edges");
        Map<String, SortedSet<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : edges.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
        }
        for (Map.Entry<String, SortedSet<String>> entry : copy.entrySet()) {
            for (String target : entry.getValue()) {
                if (!copy.containsKey(target)) {
                    throw new IllegalArgumentException(
                            "Edge " + entry.getKey() + " -> " + target + " points outside the graph");
                }
            }
        }
        this.edges = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds the graph from parsed bodies. Names without a parsed body (for instance because the body
     * failed to parse) become nodes without outgoing edges.
     */
    public static DependencyGraph build(
            Collection<String> names, Map<String, ParsedFormula> parsed, CallExtractor extractor) {
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(parsed, "parsed");
        Objects.requireNonNull(extractor, "extractor");
        Set<String> known = Set.copyOf(names);
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (String name : names) {
            ParsedFormula formula = parsed.get(name);
            edges.put(name, formula == null ? Set.of() : extractor.dependencies(formula.getRoot(), known));
        }
        return new DependencyGraph(edges);
    }

    /** Node names in insertion (catalog) order. */
    public Set<String> names() {
        return edges.keySet();
    }

    public SortedSet<String> dependenciesOf(String name) {
        SortedSet<String> dependencies = edges.get(name);
        if (dependencies == null) {
            throw new IllegalArgumentException("Unknown formula: " + name);
        }
        return dependencies;
    }

    public Map<String, SortedSet<String>> asMap() {
        return edges;
    }

    public void requireAcyclic() throws CircularDependencyException {
        List<List<String>> cycles = new CycleDetector().findCycles(this);
        if (!cycles.isEmpty()) {
            throw new CircularDependencyException(cycles);
        }
    }

    /** All nodes with every callee before its callers; ties follow catalog order. */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>(edges.size());
        Set<String> done = new HashSet<>();
        for (String root : edges.keySet()) {
            postOrder(root, done, order);
        }
        return order;
    }

    /** {@code name} and everything it reaches, callees first and {@code name} last. */
    public List<String> postOrderFrom(String name) {
        dependenciesOf(name);
        List<String> order = new ArrayList<>();
        postOrder(name, new HashSet<>(), order);
        return order;
    }

    private void postOrder(String root, Set<String> done, List<String> out) {
        if (done.contains(root)) {
            return;
        }
        Set<String> onPath = new HashSet<>();
        Deque<String> nodes = new ArrayDeque<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        nodes.push(root);
        pending.push(edges.get(root).iterator());
        onPath.add(root);
        while (!nodes.isEmpty()) {
            Iterator<String> neighbors = pending.peek();
            if (neighbors.hasNext()) {
                String next = neighbors.next();
                if (onPath.contains(next)) {
                    throw new IllegalStateException("Dependency cycle through " + next);
                }
                if (!done.contains(next)) {
                    nodes.push(next);
                    pending.push(edges.get(next).iterator());
                    onPath.add(next);
                }
            } else {
                String finished = nodes.pop();
                pending.pop();
                onPath.remove(finished);
                done.add(finished);
                out.add(finished);
            }
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }
}

package com.sheetfunctions.docs.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Three-colour depth-first search over a {@link DependencyGraph}. Roots are visited in graph order and
 * every back edge found is reported once as the path slice from its target to the closing edge.
 */
public final class CycleDetector {

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }

    private record Frame(String node, Iterator<String> neighbors) {}

    /** @return detected cycles such as {@code [A, B, A]}; empty when the graph is acyclic */
    public List<List<String>> findCycles(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Color> colors = new HashMap<>();
        for (String name : graph.names()) {
            colors.put(name, Color.WHITE);
        }
        List<List<String>> cycles = new ArrayList<>();
        for (String root : graph.names()) {
            if (colors.get(root) == Color.WHITE) {
                explore(graph, root, colors, cycles);
            }
        }
        return cycles;
    }

    public static String describe(List<String> cycle) {
        return String.join(" → ", cycle);
    }

    private static void explore(
            DependencyGraph graph, String root, Map<String, Color> colors, List<List<String>> cycles) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        enter(graph, root, colors, stack, path);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.neighbors().hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                colors.put(frame.node(), Color.BLACK);
                continue;
            }
            String neighbor = frame.neighbors().next();
            Color color = colors.get(neighbor);
            if (color == Color.GRAY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                cycle.add(neighbor);
                cycles.add(List.copyOf(cycle));
            } else if (color == Color.WHITE) {
                enter(graph, neighbor, colors, stack, path);
            }
        }
    }

    private static void enter(
            DependencyGraph graph,
            String node,
            Map<String, Color> colors,
            Deque<Frame> stack,
            List<String> path) {
        colors.put(node, Color.GRAY);
        path.add(node);
        stack.push(new Frame(node, graph.dependenciesOf(node).iterator()));
    }
}

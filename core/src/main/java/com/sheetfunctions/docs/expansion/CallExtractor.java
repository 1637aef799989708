package com.sheetfunctions.docs.expansion;

import com.sheetfunctions.docs.parser.ast.FormulaNode;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/** Finds calls to a known set of function names anywhere in a formula tree. */
public final class CallExtractor {
    private static final Comparator<CallSite> DEEPEST_FIRST =
            Comparator.comparingInt(CallSite::getDepth).reversed();

    /**
     * Returns every call whose name is in {@code namedFunctions}, deepest first. Calls at equal depth
     * keep their source order. Arguments of calls to other functions are searched as well.
     */
    public List<CallSite> extract(FormulaNode root, Set<String> namedFunctions) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(namedFunctions, "namedFunctions");
        List<CallSite> calls = new ArrayList<>();
        walk(root, 0, namedFunctions, calls);
        calls.sort(DEEPEST_FIRST);
        return calls;
    }

    /** Distinct names called from {@code root}, sorted. */
    public SortedSet<String> dependencies(FormulaNode root, Set<String> namedFunctions) {
        SortedSet<String> names = new TreeSet<>();
        for (CallSite call : extract(root, namedFunctions)) {
            names.add(call.getFunctionName());
        }
        return names;
    }

    private static void walk(FormulaNode node, int depth, Set<String> namedFunctions, List<CallSite> out) {
        int childDepth = depth;
        if (node instanceof FunctionCallNode call && namedFunctions.contains(call.getName())) {
            out.add(new CallSite(call, depth));
            childDepth = depth + 1;
        }
        for (FormulaNode child : node.children()) {
            walk(child, childDepth, namedFunctions, out);
        }
    }
}

package com.sheetfunctions.docs.expansion;

import com.sheetfunctions.docs.parser.ast.FormulaNode;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import java.util.List;
import java.util.Objects;

/**
 * One call to a catalog function inside a parsed formula. Depth counts the catalog calls that
 * enclose this one, so a call that is not nested inside another catalog call has depth 0.
 */
public final class CallSite {
    private final FunctionCallNode node;
    private final int depth;

    public CallSite(FunctionCallNode node, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0: " + depth);
        }
        this.node = Objects.requireNonNull(node, "node");
        this.depth = depth;
    }

    public String getFunctionName() {
        return node.getName();
    }

    public List<FormulaNode> getArguments() {
        return node.getArguments();
    }

    public int getDepth() {
        return depth;
    }

    public FunctionCallNode getNode() {
        return node;
    }

    @Override
    public String toString() {
        return getFunctionName() + "@" + depth;
    }
}

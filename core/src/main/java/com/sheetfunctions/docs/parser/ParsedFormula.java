package com.sheetfunctions.docs.parser;

import com.sheetfunctions.docs.parser.ast.FormulaNode;
import java.util.Objects;

/** Parse result: the normalized text that node spans index into, and the tree root. */
public final class ParsedFormula {
    private final String source;
    private final FormulaNode root;

    public ParsedFormula(String source, FormulaNode root) {
        this.source = Objects.requireNonNull(source, "source");
        this.root = Objects.requireNonNull(root, "root");
    }

    public String getSource() {
        return source;
    }

    public FormulaNode getRoot() {
        return root;
    }

    /** Source text covered by {@code node}, which must belong to this tree. */
    public String textOf(FormulaNode node) {
        return node.getSpan().slice(source);
    }
}

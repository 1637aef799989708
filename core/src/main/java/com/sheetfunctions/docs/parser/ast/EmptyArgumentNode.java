package com.sheetfunctions.docs.parser.ast;

import java.util.List;

/** Placeholder for an elided argument, e.g. each slot of {@code IF(,,)}. Its span is zero-width. */
public final class EmptyArgumentNode extends FormulaNode {

    public EmptyArgumentNode(SourceSpan span) {
        super(span);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitEmptyArgument(this);
    }

    @Override
    public String toString() {
        return "EmptyArgument";
    }
}

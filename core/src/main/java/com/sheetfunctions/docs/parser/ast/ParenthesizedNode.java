package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

public final class ParenthesizedNode extends FormulaNode {
    private final FormulaNode inner;

    public ParenthesizedNode(SourceSpan span, FormulaNode inner) {
        super(span);
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public FormulaNode getInner() {
        return inner;
    }

    @Override
    public List<FormulaNode> children() {
        return List.of(inner);
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitParenthesized(this);
    }

    @Override
    public String toString() {
        return "Parenthesized[" + inner + "]";
    }
}

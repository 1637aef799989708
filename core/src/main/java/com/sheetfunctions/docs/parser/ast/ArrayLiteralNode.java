package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

/** Array literal such as {@code {1,2;3,4}}, kept as raw text including the braces. */
public final class ArrayLiteralNode extends FormulaNode {
    private final String text;

    public ArrayLiteralNode(SourceSpan span, String text) {
        super(span);
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public String toString() {
        return "ArrayLiteral[" + text + "]";
    }
}

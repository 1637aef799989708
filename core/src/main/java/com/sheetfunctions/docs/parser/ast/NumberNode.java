package com.sheetfunctions.docs.parser.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/** Numeric literal. The source spelling is kept so {@code 1.50} is written back as {@code 1.50}. */
public final class NumberNode extends FormulaNode {
    private final String text;

    public NumberNode(SourceSpan span, String text) {
        super(span);
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    public BigDecimal getValue() {
        return new BigDecimal(text);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return "Number[" + text + "]";
    }
}

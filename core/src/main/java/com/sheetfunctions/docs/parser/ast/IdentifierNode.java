package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

/** Cell reference ({@code $A$1}), range reference ({@code A1:B10}) or bare name. */
public final class IdentifierNode extends FormulaNode {
    private final String name;

    public IdentifierNode(SourceSpan span, String name) {
        super(span);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public boolean isRange() {
        return name.indexOf(':') >= 0;
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return "Identifier[" + name + "]";
    }
}

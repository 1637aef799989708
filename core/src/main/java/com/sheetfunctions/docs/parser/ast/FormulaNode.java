package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed formula. The hierarchy is closed: every variant the grammar can produce has
 * exactly one subclass, and trees are never mutated after construction.
 */
public sealed abstract class FormulaNode
        permits FunctionCallNode,
                StringLiteralNode,
                NumberNode,
                IdentifierNode,
                ArrayLiteralNode,
                ParenthesizedNode,
                EmptyArgumentNode,
                SequenceNode,
                InvocationNode {

    private final SourceSpan span;

    protected FormulaNode(SourceSpan span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    public SourceSpan getSpan() {
        return span;
    }

    /** Direct children in source order. Leaves return an empty list. */
    public abstract List<FormulaNode> children();

    public abstract <T> T accept(FormulaNodeVisitor<T> visitor);
}

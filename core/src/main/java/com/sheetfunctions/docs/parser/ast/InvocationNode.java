package com.sheetfunctions.docs.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immediate invocation of a call result, e.g. {@code LAMBDA(x, x + 1)(5)}. Only produced when the
 * parser is configured to accept it.
 */
public final class InvocationNode extends FormulaNode {
    private final FormulaNode target;
    private final List<FormulaNode> arguments;

    public InvocationNode(SourceSpan span, FormulaNode target, List<FormulaNode> arguments) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.arguments = List.copyOf(arguments);
    }

    public FormulaNode getTarget() {
        return target;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public List<FormulaNode> children() {
        List<FormulaNode> children = new ArrayList<>(arguments.size() + 1);
        children.add(target);
        children.addAll(arguments);
        return children;
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitInvocation(this);
    }

    @Override
    public String toString() {
        return "Invocation[" + target + ", " + arguments.size() + " args]";
    }
}

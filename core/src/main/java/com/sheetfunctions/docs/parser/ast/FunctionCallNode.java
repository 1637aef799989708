package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionCallNode extends FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionCallNode(SourceSpan span, String name, List<FormulaNode> arguments) {
        super(span);
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public List<FormulaNode> children() {
        return arguments;
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return "FunctionCall[" + name + ", " + arguments.size() + " args]";
    }
}

package com.sheetfunctions.docs.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operator chain such as {@code a + -b & "x"}. Operators are kept in source order without any
 * precedence structure. A lone operand with unary prefixes ({@code --A1}) is also a sequence.
 */
public final class SequenceNode extends FormulaNode {
    private final List<Item> items;

    public SequenceNode(SourceSpan span, List<Item> items) {
        super(span);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Sequence requires at least one item");
        }
        if (items.get(0).getOperator() != null) {
            throw new IllegalArgumentException("First sequence item cannot carry a binary operator");
        }
        this.items = List.copyOf(items);
    }

    public List<Item> getItems() {
        return items;
    }

    @Override
    public List<FormulaNode> children() {
        List<FormulaNode> operands = new ArrayList<>(items.size());
        for (Item item : items) {
            operands.add(item.getOperand());
        }
        return operands;
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitSequence(this);
    }

    @Override
    public String toString() {
        return "Sequence" + items;
    }

    /** One operand together with the binary operator before it (null for the first) and its unary prefixes. */
    public static final class Item {
        private final String operator;
        private final List<String> unaryPrefixes;
        private final FormulaNode operand;

        public Item(String operator, List<String> unaryPrefixes, FormulaNode operand) {
            this.operator = operator;
            this.unaryPrefixes = List.copyOf(unaryPrefixes);
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        public String getOperator() {
            return operator;
        }

        public List<String> getUnaryPrefixes() {
            return unaryPrefixes;
        }

        public FormulaNode getOperand() {
            return operand;
        }

        @Override
        public String toString() {
            return (operator == null ? "" : operator + " ") + String.join("", unaryPrefixes) + operand;
        }
    }
}

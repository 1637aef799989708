package com.sheetfunctions.docs.expansion;

import com.sheetfunctions.docs.parser.ast.ArrayLiteralNode;
import com.sheetfunctions.docs.parser.ast.EmptyArgumentNode;
import com.sheetfunctions.docs.parser.ast.FormulaNode;
import com.sheetfunctions.docs.parser.ast.FormulaNodeVisitor;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import com.sheetfunctions.docs.parser.ast.IdentifierNode;
import com.sheetfunctions.docs.parser.ast.InvocationNode;
import com.sheetfunctions.docs.parser.ast.NumberNode;
import com.sheetfunctions.docs.parser.ast.ParenthesizedNode;
import com.sheetfunctions.docs.parser.ast.SequenceNode;
import com.sheetfunctions.docs.parser.ast.StringLiteralNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes formula trees back to text. For a tree produced by the parser the output equals the source
 * except for whitespace: arguments are separated by {@code ", "} (just {@code ","} before an elided
 * argument) and sequence items by single spaces.
 */
public final class FormulaWriter {
    private final Visitor visitor = new Visitor();

    public String writeCall(String functionName, List<FormulaNode> arguments) {
        Objects.requireNonNull(functionName, "functionName");
        return functionName + "(" + writeArguments(arguments) + ")";
    }

    public String write(FormulaNode node) {
        return Objects.requireNonNull(node, "node").accept(visitor);
    }

    static String joinArguments(List<String> arguments) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            String argument = arguments.get(i);
            if (i > 0) {
                out.append(argument.isEmpty() ? "," : ", ");
            }
            out.append(argument);
        }
        return out.toString();
    }

    private String writeArguments(List<FormulaNode> arguments) {
        List<String> written = new ArrayList<>(arguments.size());
        for (FormulaNode argument : arguments) {
            written.add(write(argument));
        }
        return joinArguments(written);
    }

    private final class Visitor implements FormulaNodeVisitor<String> {

        @Override
        public String visitFunctionCall(FunctionCallNode node) {
            return writeCall(node.getName(), node.getArguments());
        }

        @Override
        public String visitStringLiteral(StringLiteralNode node) {
            return node.toSource();
        }

        @Override
        public String visitNumber(NumberNode node) {
            return node.getText();
        }

        @Override
        public String visitIdentifier(IdentifierNode node) {
            return node.getName();
        }

        @Override
        public String visitArrayLiteral(ArrayLiteralNode node) {
            return node.getText();
        }

        @Override
        public String visitParenthesized(ParenthesizedNode node) {
            return "(" + write(node.getInner()) + ")";
        }

        @Override
        public String visitEmptyArgument(EmptyArgumentNode node) {
            return "";
        }

        @Override
        public String visitSequence(SequenceNode node) {
            StringBuilder out = new StringBuilder();
            for (SequenceNode.Item item : node.getItems()) {
                if (out.length() > 0) {
                    out.append(' ');
                }
                if (item.getOperator() != null) {
                    out.append(item.getOperator()).append(' ');
                }
                for (String prefix : item.getUnaryPrefixes()) {
                    out.append(prefix);
                }
                out.append(write(item.getOperand()));
            }
            return out.toString();
        }

        @Override
        public String visitInvocation(InvocationNode node) {
            return write(node.getTarget()) + "(" + writeArguments(node.getArguments()) + ")";
        }
    }
}

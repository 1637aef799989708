package com.sheetfunctions.docs.parser;

import com.sheetfunctions.docs.parser.ast.ArrayLiteralNode;
import com.sheetfunctions.docs.parser.ast.EmptyArgumentNode;
import com.sheetfunctions.docs.parser.ast.FormulaNode;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import com.sheetfunctions.docs.parser.ast.IdentifierNode;
import com.sheetfunctions.docs.parser.ast.InvocationNode;
import com.sheetfunctions.docs.parser.ast.NumberNode;
import com.sheetfunctions.docs.parser.ast.ParenthesizedNode;
import com.sheetfunctions.docs.parser.ast.SequenceNode;
import com.sheetfunctions.docs.parser.ast.SourceSpan;
import com.sheetfunctions.docs.parser.ast.StringLiteralNode;
import com.sheetfunctions.docs.parser.grammar.SheetsFormulaBaseVisitor;
import com.sheetfunctions.docs.parser.grammar.SheetsFormulaLexer;
import com.sheetfunctions.docs.parser.grammar.SheetsFormulaParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/** Parses formula bodies with the ANTLR grammar and converts the parse tree into {@link FormulaNode}s. */
public final class FormulaAstBuilder {
    private final ParserOptions options;

    public FormulaAstBuilder() {
        this(ParserOptions.defaults());
    }

    public FormulaAstBuilder(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Strips surrounding whitespace and any leading {@code =} so that {@code "=A1+B1"} and
     * {@code "A1+B1"} parse identically.
     */
    public static String normalize(String formula) {
        Objects.requireNonNull(formula, "formula");
        String text = formula.strip();
        int index = 0;
        while (index < text.length() && text.charAt(index) == '=') {
            index++;
        }
        return text.substring(index).strip();
    }

    /**
     * Splits text into tokens, whitespace included, so that concatenating the token texts
     * reproduces {@code text} exactly.
     */
    public static List<Token> tokenize(String text) throws FormulaParseException {
        Objects.requireNonNull(text, "text");
        SheetsFormulaLexer lexer = new SheetsFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        try {
            List<? extends Token> tokens = lexer.getAllTokens();
            return new ArrayList<>(tokens);
        } catch (ThrowingErrorListener.SyntaxError ex) {
            throw new FormulaParseException(ex.getMessage(), ex.getLine(), ex.getColumn(), ex);
        }
    }

    public ParsedFormula parse(String formula) throws FormulaParseException {
        String source = normalize(formula);

        SheetsFormulaLexer lexer = new SheetsFormulaLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        SheetsFormulaParser parser = new SheetsFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(source, tokens, lexer);
                tokens.seek(0);
            }
            SheetsFormulaParser.FormulaContext context = parser.formula();
            FormulaNode root = new AstBuildingVisitor(options).visit(context);
            return new ParsedFormula(source, root);
        } catch (ThrowingErrorListener.SyntaxError ex) {
            throw new FormulaParseException(ex.getMessage(), ex.getLine(), ex.getColumn(), ex);
        }
    }

    private static final class AstBuildingVisitor extends SheetsFormulaBaseVisitor<FormulaNode> {
        private final ParserOptions options;

        AstBuildingVisitor(ParserOptions options) {
            this.options = options;
        }

        @Override
        public FormulaNode visitFormula(SheetsFormulaParser.FormulaContext ctx) {
            return visit(ctx.expression());
        }

        @Override
        public FormulaNode visitExpression(SheetsFormulaParser.ExpressionContext ctx) {
            List<SheetsFormulaParser.OperandContext> operands = ctx.operand();
            List<SheetsFormulaParser.BinaryOperatorContext> operators = ctx.binaryOperator();
            if (operands.size() == 1 && operands.get(0).unaryOperator().isEmpty()) {
                return visit(operands.get(0).term());
            }
            List<SequenceNode.Item> items = new ArrayList<>(operands.size());
            for (int i = 0; i < operands.size(); i++) {
                SheetsFormulaParser.OperandContext operand = operands.get(i);
                String operator = i == 0 ? null : operators.get(i - 1).getText();
                List<String> prefixes = new ArrayList<>();
                for (SheetsFormulaParser.UnaryOperatorContext unary : operand.unaryOperator()) {
                    prefixes.add(unary.getText());
                }
                items.add(new SequenceNode.Item(operator, prefixes, visit(operand.term())));
            }
            return new SequenceNode(span(ctx), items);
        }

        @Override
        public FormulaNode visitParenthesizedTerm(SheetsFormulaParser.ParenthesizedTermContext ctx) {
            FormulaNode inner = visit(ctx.expression());
            FormulaNode node =
                    new ParenthesizedNode(span(ctx.LPAREN().getSymbol(), ctx.RPAREN().getSymbol()), inner);
            return applyInvocations(node, ctx.invocation());
        }

        @Override
        public FormulaNode visitFunctionCallTerm(SheetsFormulaParser.FunctionCallTermContext ctx) {
            String name = ctx.functionName().getText();
            List<FormulaNode> arguments = arguments(ctx.argumentList());
            FormulaNode node =
                    new FunctionCallNode(
                            span(ctx.functionName().getStart(), ctx.RPAREN().getSymbol()), name, arguments);
            return applyInvocations(node, ctx.invocation());
        }

        @Override
        public FormulaNode visitStringTerm(SheetsFormulaParser.StringTermContext ctx) {
            Token token = ctx.STRING().getSymbol();
            return StringLiteralNode.fromSource(span(token, token), token.getText());
        }

        @Override
        public FormulaNode visitArrayTerm(SheetsFormulaParser.ArrayTermContext ctx) {
            Token token = ctx.ARRAY().getSymbol();
            return new ArrayLiteralNode(span(token, token), token.getText());
        }

        @Override
        public FormulaNode visitRangeTerm(SheetsFormulaParser.RangeTermContext ctx) {
            Token token = ctx.RANGE().getSymbol();
            return new IdentifierNode(span(token, token), token.getText());
        }

        @Override
        public FormulaNode visitNumberTerm(SheetsFormulaParser.NumberTermContext ctx) {
            Token token = ctx.NUMBER().getSymbol();
            return new NumberNode(span(token, token), token.getText());
        }

        @Override
        public FormulaNode visitIdentifierTerm(SheetsFormulaParser.IdentifierTermContext ctx) {
            Token token = ctx.NAME().getSymbol();
            return new IdentifierNode(span(token, token), token.getText());
        }

        private FormulaNode applyInvocations(
                FormulaNode target, List<SheetsFormulaParser.InvocationContext> invocations) {
            FormulaNode node = target;
            for (SheetsFormulaParser.InvocationContext invocation : invocations) {
                if (!options.allowsImmediateInvocation()) {
                    Token open = invocation.LPAREN().getSymbol();
                    throw new ThrowingErrorListener.SyntaxError(
                            open.getLine(),
                            open.getCharPositionInLine() + 1,
                            "immediately invoked call is not allowed",
                            null);
                }
                SourceSpan span =
                        new SourceSpan(
                                node.getSpan().getStart(), invocation.RPAREN().getSymbol().getStopIndex() + 1);
                node = new InvocationNode(span, node, arguments(invocation.argumentList()));
            }
            return node;
        }

        private List<FormulaNode> arguments(SheetsFormulaParser.ArgumentListContext ctx) {
            List<FormulaNode> arguments = new ArrayList<>();
            for (SheetsFormulaParser.ArgumentContext argument : ctx.argument()) {
                if (argument.expression() == null) {
                    // An empty rule starts at the delimiter that follows it.
                    int position = argument.getStart().getStartIndex();
                    arguments.add(new EmptyArgumentNode(SourceSpan.empty(position)));
                } else {
                    arguments.add(visit(argument.expression()));
                }
            }
            // FUNC() yields a single elided argument; it is a zero-argument call.
            if (arguments.size() == 1 && arguments.get(0) instanceof EmptyArgumentNode) {
                return List.of();
            }
            return arguments;
        }

        private static SourceSpan span(ParserRuleContext ctx) {
            return span(ctx.getStart(), ctx.getStop());
        }

        private static SourceSpan span(Token start, Token stop) {
            return new SourceSpan(start.getStartIndex(), stop.getStopIndex() + 1);
        }
    }
}

package com.sheetfunctions.docs.parser.ast;

public interface FormulaNodeVisitor<T> {

    T visitFunctionCall(FunctionCallNode node);

    T visitStringLiteral(StringLiteralNode node);

    T visitNumber(NumberNode node);

    T visitIdentifier(IdentifierNode node);

    T visitArrayLiteral(ArrayLiteralNode node);

    T visitParenthesized(ParenthesizedNode node);

    T visitEmptyArgument(EmptyArgumentNode node);

    T visitSequence(SequenceNode node);

    T visitInvocation(InvocationNode node);
}

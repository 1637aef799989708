package com.sheetfunctions.docs.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Quoted string. {@link #getValue()} is the unescaped content; doubled delimiters in the source
 * collapse to a single character.
 */
public final class StringLiteralNode extends FormulaNode {
    private final char quote;
    private final String value;

    public StringLiteralNode(SourceSpan span, char quote, String value) {
        super(span);
        if (quote != '"' && quote != '\'') {
            throw new IllegalArgumentException("Unsupported string delimiter: " + quote);
        }
        this.quote = quote;
        this.value = Objects.requireNonNull(value, "value");
    }

    /** Builds a node from quoted source text such as {@code "Say ""Hi"""}. */
    public static StringLiteralNode fromSource(SourceSpan span, String quoted) {
        Objects.requireNonNull(quoted, "quoted");
        if (quoted.length() < 2 || quoted.charAt(0) != quoted.charAt(quoted.length() - 1)) {
            throw new IllegalArgumentException("Not a quoted string literal: " + quoted);
        }
        char quote = quoted.charAt(0);
        String delimiter = String.valueOf(quote);
        String content = quoted.substring(1, quoted.length() - 1).replace(delimiter + delimiter, delimiter);
        return new StringLiteralNode(span, quote, content);
    }

    public char getQuote() {
        return quote;
    }

    public String getValue() {
        return value;
    }

    /** Source form: delimiter re-added and embedded delimiters doubled again. */
    public String toSource() {
        String delimiter = String.valueOf(quote);
        return delimiter + value.replace(delimiter, delimiter + delimiter) + delimiter;
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }

    @Override
    public <T> T accept(FormulaNodeVisitor<T> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String toString() {
        return "StringLiteral[" + toSource() + "]";
    }
}

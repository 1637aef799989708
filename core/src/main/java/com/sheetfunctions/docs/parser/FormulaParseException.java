package com.sheetfunctions.docs.parser;

/**
 * Checked exception signalling that a formula body does not match the grammar. Line and column are
 * 1-based and refer to the normalized text (leading {@code =} and surrounding whitespace removed);
 * both are 0 when no position is known.
 */
public final class FormulaParseException extends Exception {
    private final int line;
    private final int column;

    public FormulaParseException(String message) {
        this(message, 0, 0, null);
    }

    public FormulaParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

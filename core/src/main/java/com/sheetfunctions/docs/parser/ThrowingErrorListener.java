package com.sheetfunctions.docs.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new SyntaxError(line, charPositionInLine + 1, msg, e);
    }

    /** Carries the position out of ANTLR so it can be reported on {@link FormulaParseException}. */
    static final class SyntaxError extends ParseCancellationException {
        private final int line;
        private final int column;

        SyntaxError(int line, int column, String detail, Throwable cause) {
            super("line " + line + ":" + column + " " + detail, cause);
            this.line = line;
            this.column = column;
        }

        int getLine() {
            return line;
        }

        int getColumn() {
            return column;
        }
    }
}

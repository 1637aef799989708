package com.sheetfunctions.docs.build;

import java.util.Objects;

/**
 * A diagnostic produced while building documentation, attached to the formula it concerns. Line and
 * column are 1-based positions in the formula body, or 0 when the message has no position.
 */
public final class BuildMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String formulaName;
    private final String message;
    private final int line;
    private final int column;

    public BuildMessage(Level level, String formulaName, String message, int line, int column) {
        this.level = Objects.requireNonNull(level, "level");
        this.formulaName = Objects.requireNonNull(formulaName, "formulaName");
        this.message = Objects.requireNonNull(message, "message");
        this.line = line;
        this.column = column;
    }

    public static BuildMessage error(String formulaName, String message) {
        return new BuildMessage(Level.ERROR, formulaName, message, 0, 0);
    }

    public static BuildMessage error(String formulaName, String message, int line, int column) {
        return new BuildMessage(Level.ERROR, formulaName, message, line, column);
    }

    public static BuildMessage warning(String formulaName, String message) {
        return new BuildMessage(Level.WARNING, formulaName, message, 0, 0);
    }

    public static BuildMessage info(String formulaName, String message) {
        return new BuildMessage(Level.INFO, formulaName, message, 0, 0);
    }

    public Level getLevel() {
        return level;
    }

    public String getFormulaName() {
        return formulaName;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isError() {
        return level == Level.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder().append(level).append(' ').append(formulaName);
        if (line > 0) {
            out.append(" (").append(line).append(':').append(column).append(')');
        }
        return out.append(": ").append(message).toString();
    }
}

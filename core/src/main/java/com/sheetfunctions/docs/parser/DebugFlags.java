package com.sheetfunctions.docs.parser;

import com.sheetfunctions.docs.parser.grammar.SheetsFormulaLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Parser debugging switches. Output goes to {@code System.err} and is also kept per thread so tests
 * can inspect it with the {@code drain} methods.
 */
public final class DebugFlags {
    public static final String TOKENS_PROPERTY = "sheetfunctions.docs.debugTokens";
    public static final String PARSER_PROPERTY = "sheetfunctions.docs.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "SHEETFUNCTIONS_DOCS_DEBUG_TOKENS";
    private static final String PARSER_ENV = "SHEETFUNCTIONS_DOCS_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    /** Dumps the default-channel tokens of {@code formula}; whitespace is skipped. */
    public static void logTokens(String formula, CommonTokenStream tokens, SheetsFormulaLexer lexer) {
        System.err.printf(Locale.ROOT, "[Sheet Functions Docs] Tokens for %s%n", formula);
        for (Token token : tokens.getTokens()) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                continue;
            }
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-10s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            System.err.printf(Locale.ROOT, "  %s%n", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    public static void captureDiagnostic(String message) {
        System.err.printf(Locale.ROOT, "[Sheet Functions Docs] %s%n", message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedTokens() {
        return drain(CAPTURED_TOKENS);
    }

    public static List<String> drainCapturedDiagnostics() {
        return drain(CAPTURED_DIAGNOSTICS);
    }

    private static List<String> drain(ThreadLocal<List<String>> buffer) {
        List<String> captured = List.copyOf(buffer.get());
        buffer.get().clear();
        return captured;
    }
}

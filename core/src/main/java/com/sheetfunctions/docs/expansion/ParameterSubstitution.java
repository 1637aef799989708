package com.sheetfunctions.docs.expansion;

import com.sheetfunctions.docs.catalog.ParameterSpec;
import com.sheetfunctions.docs.parser.FormulaAstBuilder;
import com.sheetfunctions.docs.parser.FormulaParseException;
import com.sheetfunctions.docs.parser.grammar.SheetsFormulaLexer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.antlr.v4.runtime.Token;

/**
 * Replaces parameter names in a function body with argument text.
 *
 * <p>The body is tokenized with the formula lexer and only whole {@code NAME} tokens are replaced,
 * so {@code range} never matches inside {@code input_range} or inside a string literal. The lexer
 * reads {@code first:last} as one {@code RANGE} token; each side of its colon is matched on its own.
 * All parameters are replaced in a single pass; argument text is never scanned again.</p>
 */
public final class ParameterSubstitution {

    public String substitute(
            String functionName, String body, List<ParameterSpec> parameters, List<String> arguments)
            throws ExpansionException {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(arguments, "arguments");
        if (parameters.size() != arguments.size()) {
            throw new ParameterCountMismatchException(functionName, parameters.size(), arguments.size());
        }
        if (parameters.isEmpty()) {
            return body;
        }

        Map<String, String> replacements = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            // First declaration wins if a name repeats.
            replacements.putIfAbsent(parameters.get(i).getName(), arguments.get(i));
        }

        List<Token> tokens;
        try {
            tokens = FormulaAstBuilder.tokenize(body);
        } catch (FormulaParseException ex) {
            throw new ExpansionException(
                    "Cannot substitute arguments into " + functionName + ": " + ex.getMessage(), ex);
        }
        StringBuilder out = new StringBuilder(body.length());
        for (Token token : tokens) {
            switch (token.getType()) {
                case SheetsFormulaLexer.NAME:
                    out.append(replacements.getOrDefault(token.getText(), token.getText()));
                    break;
                case SheetsFormulaLexer.RANGE:
                    appendRange(out, token.getText(), replacements);
                    break;
                default:
                    out.append(token.getText());
            }
        }
        return out.toString();
    }

    private static void appendRange(StringBuilder out, String range, Map<String, String> replacements) {
        int colon = range.indexOf(':');
        String first = range.substring(0, colon);
        String last = range.substring(colon + 1);
        out.append(replacements.getOrDefault(first, first))
                .append(':')
                .append(replacements.getOrDefault(last, last));
    }
}

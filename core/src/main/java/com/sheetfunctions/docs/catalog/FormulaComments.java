package com.sheetfunctions.docs.catalog;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Removes block comments and {@code //} line comments from formula text. Sheets rejects comments,
 * so catalog bodies are cleaned before they are parsed or published.
 */
public final class FormulaComments {
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");

    private FormulaComments() {}

    public static String strip(String formula) {
        Objects.requireNonNull(formula, "formula");
        String withoutBlocks = BLOCK_COMMENT.matcher(formula).replaceAll("");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }
}

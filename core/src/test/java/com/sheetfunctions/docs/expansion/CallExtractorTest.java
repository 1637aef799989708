package com.sheetfunctions.docs.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sheetfunctions.docs.parser.FormulaAstBuilder;
import com.sheetfunctions.docs.parser.ParsedFormula;
import com.sheetfunctions.docs.parser.ParserOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CallExtractorTest {
    private final FormulaAstBuilder builder = new FormulaAstBuilder();
    private final CallExtractor extractor = new CallExtractor();

    @Test
    void nestedCallsComeDeepestFirst() throws Exception {
        ParsedFormula formula = builder.parse("OUTER(INNER(x))");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("OUTER", "INNER"));

        assertEquals(2, calls.size());
        assertEquals("INNER", calls.get(0).getFunctionName());
        assertEquals(1, calls.get(0).getDepth());
        assertEquals("x", formula.textOf(calls.get(0).getArguments().get(0)));
        assertEquals("OUTER", calls.get(1).getFunctionName());
        assertEquals(0, calls.get(1).getDepth());
    }

    @Test
    void builtInCallsAreSearchedButNotReported() throws Exception {
        ParsedFormula formula = builder.parse("SUM(FOO(A1), MAX(BAR(B1), 3))");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("FOO"));

        assertEquals(1, calls.size());
        assertEquals("FOO", calls.get(0).getFunctionName());
        assertEquals(0, calls.get(0).getDepth());
    }

    @Test
    void callsAtEqualDepthKeepSourceOrder() throws Exception {
        ParsedFormula formula = builder.parse("FUNC(x) + FUNC(y) * OTHER()");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("FUNC", "OTHER"));

        assertEquals(List.of("FUNC(x)", "FUNC(y)", "OTHER()"), texts(formula, calls));
        for (CallSite call : calls) {
            assertEquals(0, call.getDepth());
        }
    }

    @Test
    void callsInsideLetAndLambdaAreFound() throws Exception {
        ParsedFormula formula =
                builder.parse("OUTER(LET(total, INNER(A1:A10), MAP(total, LAMBDA(row, INNER(row)))))");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("OUTER", "INNER"));

        assertEquals(List.of("INNER(A1:A10)", "INNER(row)"), texts(formula, calls.subList(0, 2)));
        assertEquals(1, calls.get(0).getDepth());
        assertEquals(1, calls.get(1).getDepth());
        assertEquals("OUTER", calls.get(2).getFunctionName());
    }

    @Test
    void parenthesizedAndUnaryOperandsAreSearched() throws Exception {
        ParsedFormula formula = builder.parse("-(1 + FOO(2)) & \"FOO(3)\"");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("FOO"));

        assertEquals(List.of("FOO(2)"), texts(formula, calls));
    }

    @Test
    void invocationTargetsAndArgumentsAreSearched() throws Exception {
        FormulaAstBuilder permissive = new FormulaAstBuilder(ParserOptions.withImmediateInvocation(true));
        ParsedFormula formula = permissive.parse("LAMBDA(x, FOO(x))(BAR(1))");
        List<CallSite> calls = extractor.extract(formula.getRoot(), Set.of("FOO", "BAR"));

        assertEquals(List.of("FOO(x)", "BAR(1)"), texts(formula, calls));
    }

    @Test
    void dependenciesAreDistinctAndSorted() throws Exception {
        ParsedFormula formula = builder.parse("ZED(ALPHA(1), ALPHA(2), SUM(MID(3)))");
        Set<String> names = Set.of("ZED", "ALPHA", "MID");

        assertEquals(List.of("ALPHA", "MID", "ZED"), new ArrayList<>(extractor.dependencies(formula.getRoot(), names)));
        assertTrue(extractor.dependencies(formula.getRoot(), Set.of()).isEmpty());
    }

    private static List<String> texts(ParsedFormula formula, List<CallSite> calls) {
        List<String> texts = new ArrayList<>();
        for (CallSite call : calls) {
            texts.add(formula.textOf(call.getNode()));
        }
        return texts;
    }
}

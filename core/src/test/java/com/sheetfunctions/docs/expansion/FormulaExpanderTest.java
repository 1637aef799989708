package com.sheetfunctions.docs.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sheetfunctions.docs.catalog.FormulaCatalog;
import com.sheetfunctions.docs.catalog.FormulaDefinition;
import com.sheetfunctions.docs.graph.DependencyGraph;
import com.sheetfunctions.docs.parser.FormulaAstBuilder;
import com.sheetfunctions.docs.parser.ParsedFormula;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FormulaExpanderTest {

    @Test
    void formulasWithoutCallsExpandToTheirNormalizedBody() throws Exception {
        FormulaExpander expander = expander(FormulaCatalog.of(FormulaDefinition.of("PLUS_ONE", "=A1 + 1")));
        assertEquals("A1 + 1", expander.expand("PLUS_ONE"));
    }

    @Test
    void inlinedCallsAreParenthesized() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("BLANK", "IF(,,)"),
                                FormulaDefinition.of("WRAP", "VSTACK(x, BLANK())", "x")));

        assertEquals("VSTACK(x, (IF(,,)))", expander.expand("WRAP"));
    }

    @Test
    void bodyThatIsASingleCallLosesTheOuterParentheses() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("DOUBLE", "v * 2", "v"),
                                FormulaDefinition.of("QUAD", "DOUBLE(DOUBLE(v))", "v")));

        assertEquals("(v * 2) * 2", expander.expand("QUAD"));
    }

    @Test
    void argumentsCarryAlreadyInlinedDeeperCalls() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("INNER", "ABS(n)", "n"),
                                FormulaDefinition.of("OUTER", "ROUND(value, digits)", "value", "digits"),
                                FormulaDefinition.of("TOP", "IF( A1 > 0 , OUTER(SUM(INNER(A1)), 2) , 0 )")));

        assertEquals("IF( A1 > 0 , (ROUND(SUM((ABS(A1))), 2)) , 0 )", expander.expand("TOP"));
    }

    @Test
    void cellReferenceArgumentsFillRangeEndpoints() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("SPAN", "SUM(first:last)", "first", "last"),
                                FormulaDefinition.of("CALLER", "SPAN(A1, B9) + 1")));

        assertEquals("(SUM(A1:B9)) + 1", expander.expand("CALLER"));
    }

    @Test
    void identicalCallsAreEachReplacedInPlace() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("TWICE", "n*2", "n"),
                                FormulaDefinition.of("SUMMED", "TWICE(1) + TWICE(1) & \"TWICE(1)\"")));

        assertEquals("(1*2) + (1*2) & \"TWICE(1)\"", expander.expand("SUMMED"));
    }

    @Test
    void parameterNamesInsideLongerIdentifiersSurviveExpansion() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("SIZE", "ROWS(input_range) * COLUMNS(range)", "range"),
                                FormulaDefinition.of("REPORT", "LET(input_range, B:B, SIZE(A1:C3))")));

        assertEquals("LET(input_range, B:B, (ROWS(input_range) * COLUMNS(A1:C3)))", expander.expand("REPORT"));
    }

    @Test
    void eachFormulaIsExpandedAtMostOnce() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("BASE", "A1"),
                                FormulaDefinition.of("X", "BASE() + 1"),
                                FormulaDefinition.of("Y", "BASE() * X()")));

        assertEquals("(A1) * ((A1) + 1)", expander.expand("Y"));
        assertEquals(3, expander.getCache().expansionCount());

        assertEquals("(A1) + 1", expander.expand("X"));
        assertEquals("(A1) * ((A1) + 1)", expander.expand("Y"));
        assertEquals(3, expander.getCache().expansionCount());
    }

    @Test
    void argumentCountMismatchFailsTheCaller() throws Exception {
        FormulaExpander expander =
                expander(
                        FormulaCatalog.of(
                                FormulaDefinition.of("PAIR", "a & b", "a", "b"),
                                FormulaDefinition.of("CALLER", "PAIR(1)"),
                                FormulaDefinition.of("TOP", "CALLER() & \"!\"")));

        ParameterCountMismatchException mismatch =
                assertThrows(ParameterCountMismatchException.class, () -> expander.expand("CALLER"));
        assertEquals("PAIR", mismatch.getFunctionName());
        assertEquals(ExpansionCache.State.FAILED, expander.getCache().stateOf("CALLER"));
        assertEquals(ExpansionCache.State.EXPANDED, expander.getCache().stateOf("PAIR"));

        ExpansionException dependent = assertThrows(ExpansionException.class, () -> expander.expand("TOP"));
        assertTrue(dependent.getMessage().contains("depends on CALLER"), dependent.getMessage());
        assertEquals(ExpansionCache.State.FAILED, expander.getCache().stateOf("TOP"));
    }

    @Test
    void unparsedFormulasCannotBeExpanded() throws Exception {
        FormulaCatalog catalog =
                FormulaCatalog.of(FormulaDefinition.of("BROKEN", "SUM("), FormulaDefinition.of("OK", "1"));
        Map<String, ParsedFormula> parsed = Map.of("OK", new FormulaAstBuilder().parse("1"));
        DependencyGraph graph = DependencyGraph.build(catalog.names(), parsed, new CallExtractor());
        FormulaExpander expander = new FormulaExpander(catalog, parsed, graph, new ExpansionCache());

        ExpansionException ex = assertThrows(ExpansionException.class, () -> expander.expand("BROKEN"));
        assertTrue(ex.getMessage().contains("could not be parsed"), ex.getMessage());
        assertEquals("1", expander.expand("OK"));
    }

    @Test
    void unchangedOutputIsAnInconsistency() throws Exception {
        FormulaCatalog catalog =
                FormulaCatalog.of(FormulaDefinition.of("ID", "x", "x"), FormulaDefinition.of("F", "ID(v)"));
        ExpansionCache cache = new ExpansionCache();
        cache.markExpanding("ID");
        cache.complete("ID", "ID(x)");
        FormulaExpander expander = expander(catalog, cache);

        ExpansionConsistencyException ex =
                assertThrows(ExpansionConsistencyException.class, () -> expander.expand("F"));
        assertEquals("F", ex.getFormulaName());
        assertEquals(Set.of("ID"), ex.getDependencies());
    }

    private static FormulaExpander expander(FormulaCatalog catalog) throws Exception {
        return expander(catalog, new ExpansionCache());
    }

    private static FormulaExpander expander(FormulaCatalog catalog, ExpansionCache cache) throws Exception {
        FormulaAstBuilder builder = new FormulaAstBuilder();
        Map<String, ParsedFormula> parsed = new LinkedHashMap<>();
        for (FormulaDefinition definition : catalog.definitions()) {
            parsed.put(definition.getName(), builder.parse(definition.getBody()));
        }
        DependencyGraph graph = DependencyGraph.build(catalog.names(), parsed, new CallExtractor());
        return new FormulaExpander(catalog, parsed, graph, cache);
    }
}

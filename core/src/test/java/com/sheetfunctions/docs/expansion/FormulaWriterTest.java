package com.sheetfunctions.docs.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.sheetfunctions.docs.parser.FormulaAstBuilder;
import com.sheetfunctions.docs.parser.ParserOptions;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class FormulaWriterTest {
    private final FormulaAstBuilder builder = new FormulaAstBuilder();
    private final FormulaWriter writer = new FormulaWriter();

    @Test
    void writesCanonicalFormulasUnchanged() throws Exception {
        List<String> canonical =
                List.of(
                        "IF(,,)",
                        "FUNC()",
                        "FUNC(A1,)",
                        "ERROR(\"text\" & (num_cols - 1))",
                        "--A1",
                        "+-A1",
                        "FUNC(\"Say \"\"Hello\"\"\")",
                        "'it''s' & \"\"",
                        "SUM(A1:B10, $C$1:$D$2, {1,2;3,4})",
                        "LET(x, 1.5e3, x * 2)",
                        "AND(A1 <> 0, OR(B1 <= 2, C1 >= 3))");
        for (String formula : canonical) {
            assertEquals(formula, writer.write(builder.parse(formula).getRoot()), formula);
        }
    }

    @Test
    void normalizesWhitespace() throws Exception {
        assertEquals("SUM(A1, B1)", writer.write(builder.parse("SUM( A1 ,B1 )").getRoot()));
        assertEquals(
                "IF(A1 > 0, \"yes\", 'no')", writer.write(builder.parse("IF(A1>0,\n  \"yes\",'no')").getRoot()));
        assertEquals("(A1 + B1) * -2", writer.write(builder.parse("( A1+B1 )*-2").getRoot()));
    }

    @Test
    void writingIsStableAcrossReparsing() throws Exception {
        String once = writer.write(builder.parse("MAP( A1:A3 , LAMBDA( v , IF( v>1 , v , ) ) )").getRoot());
        String twice = writer.write(builder.parse(once).getRoot());
        assertEquals("MAP(A1:A3, LAMBDA(v, IF(v > 1, v,)))", once);
        assertEquals(once, twice);
    }

    @Test
    void writeCallRebuildsACallFromArgumentNodes() throws Exception {
        FunctionCallNode source = (FunctionCallNode) builder.parse("F(x, \"a,b\", )").getRoot();
        assertEquals("G(x, \"a,b\",)", writer.writeCall("G", source.getArguments()));
        assertEquals("NOW()", writer.writeCall("NOW", List.of()));
    }

    @Test
    void elidedArgumentsUseABareComma() {
        assertEquals("a,, b", FormulaWriter.joinArguments(List.of("a", "", "b")));
        assertEquals(",", FormulaWriter.joinArguments(List.of("", "")));
        assertEquals("a, b", FormulaWriter.joinArguments(List.of("a", "b")));
    }

    @Test
    void writesImmediateInvocations() throws Exception {
        FormulaAstBuilder permissive = new FormulaAstBuilder(ParserOptions.withImmediateInvocation(true));
        assertEquals("LAMBDA(x, x + 1)(5)", writer.write(permissive.parse("LAMBDA(x,x+1)(5)").getRoot()));
    }
}

package com.sheetfunctions.docs.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class LeadingEqualsPolicyTest {

    @Test
    void expandedFormulasStartingWithListedCallsGetAnEqualsSign() {
        LeadingEqualsPolicy policy = LeadingEqualsPolicy.defaults();
        assertEquals("=LET(x, 1, x)", policy.apply("LET(x, 1, x)", true));
        assertEquals("=BYROW(A1:B2, LAMBDA(r, SUM(r)))", policy.apply("BYROW(A1:B2, LAMBDA(r, SUM(r)))", true));
        assertEquals("SUM(A1:A3)", policy.apply("SUM(A1:A3)", true));
    }

    @Test
    void untouchedBodiesArePublishedAsWritten() {
        assertEquals("LET(x, 1, x)", LeadingEqualsPolicy.defaults().apply("LET(x, 1, x)", false));
    }

    @Test
    void existingEqualsSignIsNotDoubled() {
        assertEquals("=LET(x, 1, x)", LeadingEqualsPolicy.defaults().apply("=LET(x, 1, x)", true));
    }

    @Test
    void policyCanBeDisabledOrCustomized() {
        assertEquals("LET(x, 1, x)", LeadingEqualsPolicy.none().apply("LET(x, 1, x)", true));

        LeadingEqualsPolicy custom = new LeadingEqualsPolicy(List.of("SUM("));
        assertEquals("=SUM(A1)", custom.apply("SUM(A1)", true));
        assertEquals("LET(x, 1, x)", custom.apply("LET(x, 1, x)", true));
    }
}

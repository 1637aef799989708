package com.sheetfunctions.docs.expansion;

public final class ParameterCountMismatchException extends ExpansionException {
    private final String functionName;
    private final int expected;
    private final int actual;

    public ParameterCountMismatchException(String functionName, int expected, int actual) {
        super(
                functionName
                        + " declares "
                        + expected
                        + " parameter(s) but was called with "
                        + actual
                        + " argument(s)");
        this.functionName = functionName;
        this.expected = expected;
        this.actual = actual;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

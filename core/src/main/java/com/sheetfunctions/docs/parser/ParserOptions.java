package com.sheetfunctions.docs.parser;

/** Grammar switches that are policy rather than syntax. */
public final class ParserOptions {
    private static final ParserOptions DEFAULTS = new ParserOptions(false);

    private final boolean allowImmediateInvocation;

    private ParserOptions(boolean allowImmediateInvocation) {
        this.allowImmediateInvocation = allowImmediateInvocation;
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param allow whether a call result may be invoked in place, as in {@code LAMBDA(x, x)(1)}.
     */
    public static ParserOptions withImmediateInvocation(boolean allow) {
        return allow ? new ParserOptions(true) : DEFAULTS;
    }

    public boolean allowsImmediateInvocation() {
        return allowImmediateInvocation;
    }

    @Override
    public String toString() {
        return "ParserOptions[allowImmediateInvocation=" + allowImmediateInvocation + "]";
    }
}

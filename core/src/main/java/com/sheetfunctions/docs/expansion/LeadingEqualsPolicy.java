package com.sheetfunctions.docs.expansion;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether published expanded text gets a leading {@code =}. Sheets needs it when an
 * expanded formula that starts with one of these calls is pasted into a cell. The prefix list is a
 * product decision and is configurable.
 */
public final class LeadingEqualsPolicy {
    public static final List<String> DEFAULT_PREFIXES =
            List.of("LET(", "LAMBDA(", "BYROW(", "BYCOL(", "MAKEARRAY(", "FILTER(", "DENSIFY(");

    private static final LeadingEqualsPolicy NONE = new LeadingEqualsPolicy(List.of());
    private static final LeadingEqualsPolicy DEFAULT = new LeadingEqualsPolicy(DEFAULT_PREFIXES);

    private final List<String> prefixes;

    public LeadingEqualsPolicy(List<String> prefixes) {
        this.prefixes = List.copyOf(Objects.requireNonNull(prefixes, "prefixes"));
    }

    public static LeadingEqualsPolicy defaults() {
        return DEFAULT;
    }

    public static LeadingEqualsPolicy none() {
        return NONE;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    /**
     * @param expandedText inlined text without a leading {@code =}
     * @param expanded whether any catalog call was inlined; untouched bodies are published as-is
     */
    public String apply(String expandedText, boolean expanded) {
        Objects.requireNonNull(expandedText, "expandedText");
        if (!expanded || expandedText.startsWith("=")) {
            return expandedText;
        }
        for (String prefix : prefixes) {
            if (expandedText.startsWith(prefix)) {
                return "=" + expandedText;
            }
        }
        return expandedText;
    }

    @Override
    public String toString() {
        return "LeadingEqualsPolicy" + prefixes;
    }
}

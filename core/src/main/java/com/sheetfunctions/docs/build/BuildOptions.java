package com.sheetfunctions.docs.build;

import com.sheetfunctions.docs.expansion.LeadingEqualsPolicy;
import com.sheetfunctions.docs.parser.ParserOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/** Settings for one documentation build. */
public final class BuildOptions {
    public static final String STRIP_COMMENTS_PROPERTY = "sheetfunctions.docs.stripComments";
    public static final String IMMEDIATE_INVOCATION_PROPERTY = "sheetfunctions.docs.allowImmediateInvocation";
    public static final String LEADING_EQUALS_PROPERTY = "sheetfunctions.docs.leadingEqualsPrefixes";

    private static final BuildOptions DEFAULTS = builder().build();

    private final boolean stripComments;
    private final ParserOptions parserOptions;
    private final LeadingEqualsPolicy leadingEqualsPolicy;

    private BuildOptions(Builder builder) {
        this.stripComments = builder.stripComments;
        this.parserOptions = builder.parserOptions;
        this.leadingEqualsPolicy = builder.leadingEqualsPolicy;
    }

    public static BuildOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from {@code properties}; absent keys keep their defaults. An empty
     * {@value #LEADING_EQUALS_PROPERTY} disables the leading {@code =} policy.
     */
    public static BuildOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String strip = properties.getProperty(STRIP_COMMENTS_PROPERTY);
        if (strip != null) {
            builder.stripComments(Boolean.parseBoolean(strip.trim()));
        }
        String invocation = properties.getProperty(IMMEDIATE_INVOCATION_PROPERTY);
        if (invocation != null) {
            builder.allowImmediateInvocation(Boolean.parseBoolean(invocation.trim()));
        }
        String prefixes = properties.getProperty(LEADING_EQUALS_PROPERTY);
        if (prefixes != null) {
            builder.leadingEqualsPolicy(parsePrefixes(prefixes));
        }
        return builder.build();
    }

    public static BuildOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static LeadingEqualsPolicy parsePrefixes(String value) {
        if (value.isBlank()) {
            return LeadingEqualsPolicy.none();
        }
        List<String> prefixes = new ArrayList<>();
        for (String part : value.split(",")) {
            String prefix = part.trim();
            if (prefix.isEmpty()) {
                continue;
            }
            prefixes.add(prefix.endsWith("(") ? prefix : prefix + "(");
        }
        return new LeadingEqualsPolicy(prefixes);
    }

    public boolean isStripComments() {
        return stripComments;
    }

    public ParserOptions getParserOptions() {
        return parserOptions;
    }

    public LeadingEqualsPolicy getLeadingEqualsPolicy() {
        return leadingEqualsPolicy;
    }

    @Override
    public String toString() {
        return "BuildOptions{stripComments="
                + stripComments
                + ", allowImmediateInvocation="
                + parserOptions.allowsImmediateInvocation()
                + ", leadingEquals="
                + leadingEqualsPolicy.getPrefixes()
                + '}';
    }

    public static final class Builder {
        private boolean stripComments = true;
        private ParserOptions parserOptions = ParserOptions.defaults();
        private LeadingEqualsPolicy leadingEqualsPolicy = LeadingEqualsPolicy.defaults();

        private Builder() {}

        public Builder stripComments(boolean stripComments) {
            this.stripComments = stripComments;
            return this;
        }

        public Builder allowImmediateInvocation(boolean allow) {
            this.parserOptions = ParserOptions.withImmediateInvocation(allow);
            return this;
        }

        public Builder leadingEqualsPolicy(LeadingEqualsPolicy policy) {
            this.leadingEqualsPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(this);
        }
    }
}

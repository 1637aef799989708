package com.sheetfunctions.docs.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sheetfunctions.docs.expansion.LeadingEqualsPolicy;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class BuildOptionsTest {

    @Test
    void defaults() {
        BuildOptions options = BuildOptions.defaults();
        assertTrue(options.isStripComments());
        assertFalse(options.getParserOptions().allowsImmediateInvocation());
        assertEquals(LeadingEqualsPolicy.DEFAULT_PREFIXES, options.getLeadingEqualsPolicy().getPrefixes());
    }

    @Test
    void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(BuildOptions.STRIP_COMMENTS_PROPERTY, "false");
        properties.setProperty(BuildOptions.IMMEDIATE_INVOCATION_PROPERTY, " true ");
        properties.setProperty(BuildOptions.LEADING_EQUALS_PROPERTY, "SUM, LET( ,,");

        BuildOptions options = BuildOptions.fromProperties(properties);

        assertFalse(options.isStripComments());
        assertTrue(options.getParserOptions().allowsImmediateInvocation());
        assertEquals(List.of("SUM(", "LET("), options.getLeadingEqualsPolicy().getPrefixes());
    }

    @Test
    void emptyPrefixListDisablesLeadingEquals() {
        Properties properties = new Properties();
        properties.setProperty(BuildOptions.LEADING_EQUALS_PROPERTY, "");

        BuildOptions options = BuildOptions.fromProperties(properties);

        assertTrue(options.getLeadingEqualsPolicy().getPrefixes().isEmpty());
        assertTrue(options.isStripComments());
    }

    @Test
    void builderOverridesDefaults() {
        BuildOptions options =
                BuildOptions.builder()
                        .stripComments(false)
                        .allowImmediateInvocation(true)
                        .leadingEqualsPolicy(LeadingEqualsPolicy.none())
                        .build();

        assertFalse(options.isStripComments());
        assertTrue(options.getParserOptions().allowsImmediateInvocation());
        assertTrue(options.getLeadingEqualsPolicy().getPrefixes().isEmpty());
    }
}

package com.sheetfunctions.docs.build;

import com.sheetfunctions.docs.Version;
import com.sheetfunctions.docs.catalog.FormulaCatalog;
import com.sheetfunctions.docs.catalog.FormulaComments;
import com.sheetfunctions.docs.catalog.FormulaDefinition;
import com.sheetfunctions.docs.expansion.CallExtractor;
import com.sheetfunctions.docs.expansion.ExpansionCache;
import com.sheetfunctions.docs.expansion.ExpansionConsistencyException;
import com.sheetfunctions.docs.expansion.ExpansionException;
import com.sheetfunctions.docs.expansion.FormulaExpander;
import com.sheetfunctions.docs.graph.CircularDependencyException;
import com.sheetfunctions.docs.graph.DependencyGraph;
import com.sheetfunctions.docs.parser.FormulaAstBuilder;
import com.sheetfunctions.docs.parser.FormulaParseException;
import com.sheetfunctions.docs.parser.ParsedFormula;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a catalog into expanded, publishable formulas.
 *
 * <p>Every body is parsed first and parse errors are collected. The dependency graph is then
 * checked for cycles before anything is expanded, and formulas are expanded callees first.
 * Collected errors are reported together in one {@link DocumentationBuildException}.</p>
 */
public final class DocumentationBuilder {
    private static final Logger LOGGER = Logger.getLogger(DocumentationBuilder.class.getName());

    private final BuildOptions options;
    private final FormulaAstBuilder parser;
    private final CallExtractor extractor = new CallExtractor();

    public DocumentationBuilder() {
        this(BuildOptions.defaults());
    }

    public DocumentationBuilder(BuildOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.parser = new FormulaAstBuilder(options.getParserOptions());
    }

    public BuildOptions getOptions() {
        return options;
    }

    public DocumentationBuild build(FormulaCatalog catalog) throws DocumentationBuildException {
        Objects.requireNonNull(catalog, "catalog");
        LOGGER.info(
                () -> "Building documentation for " + catalog.size() + " formula(s) [" + Version.RUNTIME + "]");
        List<BuildMessage> messages = new ArrayList<>();

        Map<String, ParsedFormula> parsed = parseAll(catalog, messages);
        DependencyGraph graph = DependencyGraph.build(catalog.names(), parsed, extractor);
        try {
            graph.requireAcyclic();
        } catch (CircularDependencyException ex) {
            LOGGER.warning(ex.getMessage());
            throw new DocumentationBuildException(
                    DocumentationBuildException.Reason.CIRCULAR_DEPENDENCY, ex.getMessage(), ex);
        }

        ExpansionCache cache = new ExpansionCache();
        for (String name : catalog.names()) {
            if (!parsed.containsKey(name)) {
                cache.fail(name);
            }
        }
        FormulaExpander expander = new FormulaExpander(catalog, parsed, graph, cache);
        for (String name : graph.topologicalOrder()) {
            if (!parsed.containsKey(name)) {
                continue;
            }
            try {
                expander.expand(name);
                LOGGER.fine(() -> "Expanded " + name);
            } catch (ExpansionConsistencyException ex) {
                LOGGER.warning(ex.getMessage());
                throw new DocumentationBuildException(
                        DocumentationBuildException.Reason.EXPANSION_INCONSISTENT, ex.getMessage(), ex);
            } catch (ExpansionException ex) {
                report(messages, BuildMessage.error(name, ex.getMessage()));
            }
        }

        List<BuildMessage> errors = new ArrayList<>();
        for (BuildMessage message : messages) {
            if (message.isError()) {
                errors.add(message);
            }
        }
        if (!errors.isEmpty()) {
            LOGGER.warning(() -> "Documentation build failed with " + errors.size() + " error(s)");
            throw new DocumentationBuildException(DocumentationBuildException.Reason.INVALID_FORMULAS, messages);
        }

        List<ExpandedFormula> formulas = new ArrayList<>(catalog.size());
        for (FormulaDefinition definition : catalog.definitions()) {
            String name = definition.getName();
            SortedSet<String> dependencies = graph.dependenciesOf(name);
            String inlined = cache.get(name).orElseThrow();
            String published = options.getLeadingEqualsPolicy().apply(inlined, !dependencies.isEmpty());
            formulas.add(new ExpandedFormula(definition, dependencies, inlined, published));
        }
        int expansions = cache.expansionCount();
        LOGGER.info(() -> "Expanded " + expansions + " formula(s)");
        return new DocumentationBuild(formulas, graph, messages, expansions);
    }

    private Map<String, ParsedFormula> parseAll(FormulaCatalog catalog, List<BuildMessage> messages) {
        Map<String, ParsedFormula> parsed = new LinkedHashMap<>();
        for (FormulaDefinition definition : catalog.definitions()) {
            String name = definition.getName();
            String body = definition.getBody();
            if (options.isStripComments()) {
                String stripped = FormulaComments.strip(body);
                if (!stripped.equals(body)) {
                    report(messages, BuildMessage.info(name, "Comments removed from formula body"));
                }
                body = stripped;
            }
            try {
                parsed.put(name, parser.parse(body));
            } catch (FormulaParseException ex) {
                report(
                        messages,
                        BuildMessage.error(
                                name, "Invalid formula syntax: " + ex.getMessage(), ex.getLine(), ex.getColumn()));
            }
        }
        return parsed;
    }

    private static void report(List<BuildMessage> messages, BuildMessage message) {
        messages.add(message);
        if (message.isError()) {
            LOGGER.warning(message::toString);
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(message.toString());
        }
    }
}

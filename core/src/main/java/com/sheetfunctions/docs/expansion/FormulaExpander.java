package com.sheetfunctions.docs.expansion;

import com.sheetfunctions.docs.catalog.FormulaCatalog;
import com.sheetfunctions.docs.catalog.FormulaDefinition;
import com.sheetfunctions.docs.graph.DependencyGraph;
import com.sheetfunctions.docs.parser.ParsedFormula;
import com.sheetfunctions.docs.parser.ast.FormulaNode;
import com.sheetfunctions.docs.parser.ast.FunctionCallNode;
import com.sheetfunctions.docs.parser.ast.SourceSpan;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Inlines every catalog call in a formula, recursively, so the result only calls built-in
 * functions.
 *
 * <p>Callees are expanded before their callers by walking the dependency graph, and each result is
 * kept in the {@link ExpansionCache}. Replacements are bound to the source span of the call they
 * replace, so repeated or overlapping call text can never be confused.</p>
 */
public final class FormulaExpander {
    private static final Logger LOGGER = Logger.getLogger(FormulaExpander.class.getName());

    private final FormulaCatalog catalog;
    private final Map<String, ParsedFormula> parsed;
    private final DependencyGraph graph;
    private final ExpansionCache cache;
    private final CallExtractor extractor = new CallExtractor();
    private final ParameterSubstitution substitution = new ParameterSubstitution();

    public FormulaExpander(
            FormulaCatalog catalog,
            Map<String, ParsedFormula> parsed,
            DependencyGraph graph,
            ExpansionCache cache) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.parsed = Map.copyOf(Objects.requireNonNull(parsed, "parsed"));
        this.graph = Objects.requireNonNull(graph, "graph");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public ExpansionCache getCache() {
        return cache;
    }

    /**
     * Returns the fully inlined text of {@code name}, without a leading {@code =}.
     *
     * @throws ExpansionException if the formula or one of its callees cannot be expanded
     */
    public String expand(String name) throws ExpansionException {
        Optional<String> cached = cache.get(name);
        if (cached.isPresent()) {
            return cached.get();
        }
        for (String next : graph.postOrderFrom(name)) {
            if (cache.stateOf(next) == ExpansionCache.State.UNEXPANDED) {
                expandSingle(next);
            }
        }
        return cache.get(name).orElseThrow(() -> new ExpansionException(name + " could not be expanded"));
    }

    private void expandSingle(String name) throws ExpansionException {
        cache.markExpanding(name);
        try {
            String text = inline(name);
            cache.complete(name, text);
        } catch (ExpansionException ex) {
            cache.fail(name);
            throw ex;
        }
    }

    private String inline(String name) throws ExpansionException {
        ParsedFormula formula = parsed.get(name);
        if (formula == null) {
            throw new ExpansionException(name + " could not be parsed");
        }
        List<CallSite> calls = extractor.extract(formula.getRoot(), catalog.names());
        if (calls.isEmpty()) {
            return formula.getSource();
        }

        String source = formula.getSource();
        Map<FormulaNode, String> replacements = new IdentityHashMap<>();
        for (CallSite call : calls) {
            String callee = call.getFunctionName();
            String calleeText = calleeExpansion(name, callee);
            List<String> arguments = new ArrayList<>(call.getArguments().size());
            for (FormulaNode argument : call.getArguments()) {
                arguments.add(splice(argument, source, replacements));
            }
            FormulaDefinition definition = catalog.get(callee);
            String substituted =
                    substitution.substitute(callee, calleeText, definition.getParameters(), arguments);
            replacements.put(call.getNode(), "(" + substituted + ")");
        }

        String result;
        FormulaNode root = formula.getRoot();
        if (root instanceof FunctionCallNode && replacements.containsKey(root)) {
            String wrapped = replacements.get(root);
            result = wrapped.substring(1, wrapped.length() - 1);
        } else {
            result = splice(root, source, replacements);
        }

        if (result.equals(source)) {
            Set<String> dependencies = new LinkedHashSet<>();
            for (CallSite call : calls) {
                dependencies.add(call.getFunctionName());
            }
            throw new ExpansionConsistencyException(name, dependencies, source);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Inlined " + calls.size() + " call(s) into " + name);
        }
        return result;
    }

    private String calleeExpansion(String caller, String callee) throws ExpansionException {
        ExpansionCache.State state = cache.stateOf(callee);
        switch (state) {
            case EXPANDED:
                return cache.get(callee).orElseThrow();
            case FAILED:
                throw new ExpansionException(
                        caller + " depends on " + callee + " which could not be expanded");
            case EXPANDING:
                throw new IllegalStateException(
                        "Expansion of " + caller + " re-entered " + callee + "; dependency cycle not detected");
            default:
                throw new IllegalStateException(callee + " was not expanded before its caller " + caller);
        }
    }

    /**
     * Source text of {@code node} with every replaced descendant substituted in. Text between child
     * spans (operators, delimiters, whitespace) is copied from {@code source}.
     */
    static String splice(FormulaNode node, String source, Map<FormulaNode, String> replacements) {
        String replacement = replacements.get(node);
        if (replacement != null) {
            return replacement;
        }
        SourceSpan span = node.getSpan();
        List<FormulaNode> children = node.children();
        if (children.isEmpty() || replacements.isEmpty()) {
            return span.slice(source);
        }
        StringBuilder out = new StringBuilder(span.length());
        int position = span.getStart();
        for (FormulaNode child : children) {
            SourceSpan childSpan = child.getSpan();
            out.append(source, position, childSpan.getStart());
            out.append(splice(child, source, replacements));
            position = childSpan.getEnd();
        }
        out.append(source, position, span.getEnd());
        return out.toString();
    }
}

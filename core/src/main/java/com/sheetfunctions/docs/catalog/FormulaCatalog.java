package com.sheetfunctions.docs.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Ordered collection of named functions for one documentation build, indexed by name. */
public final class FormulaCatalog {
    private final Map<String, FormulaDefinition> definitions;

    public FormulaCatalog(Collection<FormulaDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        Map<String, FormulaDefinition> indexed = new LinkedHashMap<>();
        for (FormulaDefinition definition : definitions) {
            Objects.requireNonNull(definition, "definition");
            if (indexed.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate formula name: " + definition.getName());
            }
        }
        this.definitions = Collections.unmodifiableMap(indexed);
    }

    public static FormulaCatalog of(FormulaDefinition... definitions) {
        return new FormulaCatalog(List.of(definitions));
    }

    /** Names in catalog order. */
    public Set<String> names() {
        return definitions.keySet();
    }

    public Collection<FormulaDefinition> definitions() {
        return definitions.values();
    }

    public Optional<FormulaDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public FormulaDefinition get(String name) {
        FormulaDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown formula: " + name);
        }
        return definition;
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public int size() {
        return definitions.size();
    }
}

package com.sheetfunctions.docs.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One named function as supplied by the catalog loader. Names are case-sensitive. The loader is
 * responsible for schema validation; this class only guards against nulls.
 */
public final class FormulaDefinition {
    private final String name;
    private final List<ParameterSpec> parameters;
    private final String body;
    private final String description;
    private final String version;

    public FormulaDefinition(String name, List<ParameterSpec> parameters, String body) {
        this(name, parameters, body, "", "");
    }

    public FormulaDefinition(
            String name, List<ParameterSpec> parameters, String body, String description, String version) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        this.body = Objects.requireNonNull(body, "body");
        this.description = description == null ? "" : description;
        this.version = version == null ? "" : version;
    }

    /** Shorthand for tests and callers that only know parameter names. */
    public static FormulaDefinition of(String name, String body, String... parameterNames) {
        List<ParameterSpec> parameters = new ArrayList<>(parameterNames.length);
        for (String parameterName : parameterNames) {
            parameters.add(new ParameterSpec(parameterName));
        }
        return new FormulaDefinition(name, parameters, body);
    }

    public String getName() {
        return name;
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    public List<String> getParameterNames() {
        List<String> names = new ArrayList<>(parameters.size());
        for (ParameterSpec parameter : parameters) {
            names.add(parameter.getName());
        }
        return names;
    }

    public String getBody() {
        return body;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return name + getParameterNames();
    }
}

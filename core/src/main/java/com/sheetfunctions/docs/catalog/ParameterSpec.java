package com.sheetfunctions.docs.catalog;

import java.util.Objects;

/** Declared parameter of a named function. Position in the owning list is significant. */
public final class ParameterSpec {
    private final String name;
    private final String description;
    private final String example;

    public ParameterSpec(String name) {
        this(name, "", "");
    }

    public ParameterSpec(String name, String description, String example) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.example = example == null ? "" : example;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getExample() {
        return example;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ParameterSpec)) {
            return false;
        }
        ParameterSpec other = (ParameterSpec) obj;
        return name.equals(other.name)
                && description.equals(other.description)
                && example.equals(other.example);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, example);
    }

    @Override
    public String toString() {
        return name;
    }
}

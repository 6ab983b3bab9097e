package org.formlite.dsl;

import java.util.Objects;

/**
 * Reference to a symbol or to a stored expression by name.
 */
public record SymbolRef(String name) implements FormExpression {
    public SymbolRef {
        Objects.requireNonNull(name, "Symbol name cannot be null");
    }

    @Override
    public String toString() {
        return name;
    }
}

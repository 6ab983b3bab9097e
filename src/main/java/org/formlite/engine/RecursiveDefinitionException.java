package org.formlite.engine;

/**
 * A stored expression that refers back to itself, directly or through other
 * stored expressions, e.g. after {@code Expression e = e + 1}.
 */
public final class RecursiveDefinitionException extends FormEvalException {

    private final String name;

    public RecursiveDefinitionException(String name) {
        super("Recursive definition of '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

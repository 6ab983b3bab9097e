package org.formlite.engine;

/**
 * Print of a name that has no stored expression.
 */
public final class UndefinedPrintTargetException extends FormEvalException {

    private final String name;

    public UndefinedPrintTargetException(String name) {
        super("Expression '" + name + "' not found");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

package org.formlite.engine;

/**
 * A literal division whose divisor is exactly zero.
 */
public final class DivisionByZeroException extends FormEvalException {

    public DivisionByZeroException() {
        super("Division by zero");
    }
}

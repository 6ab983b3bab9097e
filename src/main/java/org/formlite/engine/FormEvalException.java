package org.formlite.engine;

/**
 * Exception thrown when a FORM statement cannot be evaluated.
 *
 * Evaluation failures never leave the session tables half-updated: the
 * statement that raised the exception has no effect.
 */
public class FormEvalException extends RuntimeException {

    public FormEvalException(String message) {
        super(message);
    }
}

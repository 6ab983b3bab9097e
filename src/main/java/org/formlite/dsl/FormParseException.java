package org.formlite.dsl;

/**
 * Exception thrown when FORM statement parsing fails.
 * Carries the position of the offending token when one is known.
 */
public class FormParseException extends RuntimeException {

    private final int position;

    public FormParseException(String message) {
        super(message);
        this.position = -1;
    }

    public FormParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }
}

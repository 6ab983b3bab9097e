package org.formlite.engine;

import org.formlite.dsl.FormParser;
import org.formlite.dsl.FormStatement;

/**
 * Entry point for a host shell: one evaluator living for the whole session.
 *
 * <pre>
 * FormSession session = new FormSession();
 * session.execute("Symbols x, y");
 * session.execute("Expression e = (x + 1) * (x - 1)");
 * session.execute("id x = 2");
 * session.execute(".sort");
 * session.execute("Print e");   // "e = 3"
 * </pre>
 *
 * Not thread-safe; statements are evaluated one at a time.
 */
public final class FormSession {

    private final FormEvaluator evaluator = new FormEvaluator();

    /**
     * Parses one statement.
     *
     * @throws org.formlite.dsl.FormParseException if the text is not a valid statement
     */
    public FormStatement parse(String source) {
        return FormParser.parse(source);
    }

    /**
     * Evaluates a parsed statement and returns the text to display.
     *
     * @throws FormEvalException if evaluation fails
     */
    public String evaluate(FormStatement statement) {
        return evaluator.evaluate(statement);
    }

    /**
     * Parses and evaluates one statement.
     */
    public String execute(String source) {
        return evaluate(parse(source));
    }

    /**
     * Forgets all symbols, expressions and rules.
     */
    public void clear() {
        evaluator.clear();
    }

    public FormEvaluator evaluator() {
        return evaluator;
    }
}

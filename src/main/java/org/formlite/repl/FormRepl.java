package org.formlite.repl;

import org.formlite.dsl.FormParseException;
import org.formlite.dsl.FormStatement;
import org.formlite.engine.FormEvalException;
import org.formlite.engine.FormSession;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Line-oriented shell around a {@link FormSession}.
 *
 * Each non-blank input line is one statement. Besides FORM statements the
 * shell understands:
 * - quit, exit: leave the shell
 * - help: show usage
 * - clear: forget all symbols, expressions and rules
 *
 * Results are written to the output stream indented by two spaces; errors go
 * to the error stream prefixed with "Error: ".
 */
public final class FormRepl {

    private static final String PROMPT = "FORM> ";

    private final FormSession session = new FormSession();
    private final ReplOptions options;
    private final PrintStream out;
    private final PrintStream err;

    public FormRepl(ReplOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * Reads and evaluates lines until end of input or an exit command.
     */
    public void run(Reader input) throws IOException {
        BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);

        if (options.interactive()) {
            printBanner();
        }

        while (true) {
            if (options.interactive()) {
                out.print(PROMPT);
                out.flush();
            }
            String line = reader.readLine();
            if (line == null) {
                out.println("Goodbye!");
                return;
            }
            if (!handleLine(line)) {
                return;
            }
        }
    }

    /**
     * Handles one input line.
     *
     * @return false when the shell should stop
     */
    boolean handleLine(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return true;
        }

        switch (line) {
            case "quit", "exit" -> {
                out.println("Goodbye!");
                return false;
            }
            case "help" -> {
                printHelp();
                return true;
            }
            case "clear" -> {
                session.clear();
                out.println("Environment cleared");
                return true;
            }
            default -> {
                // FORM statement
            }
        }

        try {
            FormStatement statement = session.parse(line);
            if (options.verbose()) {
                err.println("[parsed] " + statement);
            }
            String result = session.evaluate(statement);
            if (!result.isEmpty()) {
                out.println("  " + result);
            }
        } catch (FormParseException | FormEvalException e) {
            err.println("Error: " + e.getMessage());
        }
        return true;
    }

    FormSession session() {
        return session;
    }

    private void printBanner() {
        out.println("FORM REPL v0.1.0");
        out.println("A symbolic manipulation system");
        out.println("Type 'quit' or 'exit' to exit, 'help' for help");
        out.println();
    }

    private void printHelp() {
        out.println("""

                FORM REPL Help
                ==============

                Commands:
                  quit, exit       - Exit the REPL
                  help             - Show this help message
                  clear            - Clear all definitions

                Syntax:
                  Symbols x, y, z  - Declare symbols
                  Expression e = (x + y)^2  - Define an expression
                  Local a = x + 1  - Define a local variable
                  id x = 1         - Add substitution rule
                  Print e          - Print an expression
                  .sort            - Apply all rules and simplify

                Examples:
                  > Symbols x, y
                  > Expression e = (x + 1) * (x - 1)
                  > id x = 2
                  > .sort
                  > Print e
                  > 2 + 3 * 4
                  > (1 + 2) ^ 3
                """);
    }

    public static void main(String[] args) throws IOException {
        ReplOptions options = ReplOptions.parse(args, System.err);
        FormRepl repl = new FormRepl(options, System.out, System.err);

        if (options.script() != null) {
            try (Reader reader = Files.newBufferedReader(options.script(), StandardCharsets.UTF_8)) {
                repl.run(reader);
            }
        } else {
            repl.run(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
    }
}

package org.formlite.repl;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line options of the FORM shell.
 *
 * @param verbose echo every parsed statement to the error stream
 * @param quiet   no banner and no prompt
 * @param script  file to read statements from instead of standard input, or null
 */
public record ReplOptions(boolean verbose, boolean quiet, Path script) {

    public static ReplOptions defaults() {
        return new ReplOptions(false, false, null);
    }

    /**
     * Banner and prompt are shown only when reading from a terminal session.
     */
    public boolean interactive() {
        return !quiet && script == null;
    }

    /**
     * Parses {@code [-v|--verbose] [-q|--quiet] [script]}. Unknown options are
     * reported on {@code err} and ignored.
     */
    public static ReplOptions parse(String[] args, PrintStream err) {
        boolean verbose = false;
        boolean quiet = false;
        Path script = null;

        for (String arg : args) {
            switch (arg) {
                case "-v", "--verbose" -> verbose = true;
                case "-q", "--quiet" -> quiet = true;
                default -> {
                    if (arg.startsWith("-")) {
                        err.println("Unknown option: " + arg);
                    } else if (script == null) {
                        script = Path.of(arg);
                    } else {
                        err.println("Ignoring extra argument: " + arg);
                    }
                }
            }
        }

        return new ReplOptions(verbose, quiet, script);
    }
}

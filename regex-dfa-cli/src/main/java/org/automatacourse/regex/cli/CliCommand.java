package org.automatacourse.regex.cli;

import org.automatacourse.regex.CompilerOptions;
import org.automatacourse.regex.Regex;

import java.io.IOException;
import java.io.PrintStream;

/**
 * A sub-command of {@link RegexAutomataCli}. Implementations carry their own
 * JCommander parameters.
 */
public interface CliCommand {

    /** Lets the command override options before the pattern is compiled. */
    default CompilerOptions configure(CompilerOptions options) {
        return options;
    }

    /**
     * Runs the command against the compiled pattern.
     *
     * @return the process exit status
     */
    int run(Regex regex, PrintStream out) throws IOException;
}

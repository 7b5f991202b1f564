package org.automatacourse.regex.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.automatacourse.regex.CompilerOptions;
import org.automatacourse.regex.Regex;

import java.io.PrintStream;

/**
 * Prints the NFA table, the DFA table and the minimized DFA table.
 */
@Parameters(commandDescription = "Print the NFA, DFA and minimized DFA transition tables")
public class TableCommand implements CliCommand {

    @Parameter(names = {"-s", "--simplify-notations"}, description = "Simplify notations")
    private boolean simplifyNotations;

    @Override
    public CompilerOptions configure(CompilerOptions options) {
        if (simplifyNotations) {
            return options.toBuilder().simplifyNotations(true).build();
        }
        return options;
    }

    @Override
    public int run(Regex regex, PrintStream out) {
        out.println();
        out.println("> - starting");
        out.println("✓ - accepting");
        out.println();

        out.println("NFA: Transition table:");
        out.println();
        out.println(TableRenderer.render(regex.getNfaTable()));

        out.println("DFA: Original transition table:");
        out.println();
        out.println(TableRenderer.render(regex.getDfaTable()));

        out.println("DFA: Minimized transition table");
        out.println();
        out.println(TableRenderer.render(regex.getMinimizedTable()));
        return 0;
    }
}

package org.automatacourse.regex.cli;

import com.beust.jcommander.Parameters;
import dk.brics.automaton.Automaton;
import org.automatacourse.regex.Regex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Checks the minimized DFA against a reference automaton that dk.brics builds
 * from the same AST, and reports the shortest string they disagree on.
 */
@Parameters(commandDescription = "Compare the compiled DFA with a dk.brics reference automaton")
public class VerifyCommand implements CliCommand {
    private static final Logger LOG = LoggerFactory.getLogger(VerifyCommand.class);

    @Override
    public int run(Regex regex, PrintStream out) {
        Automaton reference = ReferenceAutomata.fromAst(regex.getAst());
        Automaton compiled = ReferenceAutomata.fromDfaTable(regex.getMinimizedTable());
        LOG.debug("Reference automaton has {} states, compiled DFA has {}",
                reference.getNumberOfStates(), compiled.getNumberOfStates());

        String missing = reference.minus(compiled).getShortestExample(true);
        String extra = compiled.minus(reference).getShortestExample(true);
        if (missing == null && extra == null) {
            out.println("languages agree");
            return 0;
        }
        if (missing != null) {
            out.println("languages differ: \"" + missing + "\" matches the pattern but is rejected by the DFA");
        }
        if (extra != null) {
            out.println("languages differ: \"" + extra + "\" is accepted by the DFA but does not match the pattern");
        }
        return 1;
    }
}

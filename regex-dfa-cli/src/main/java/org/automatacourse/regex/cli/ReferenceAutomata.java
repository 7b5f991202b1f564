package org.automatacourse.regex.cli;

import com.google.common.base.Preconditions;
import dk.brics.automaton.Automaton;
import dk.brics.automaton.BasicAutomata;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;
import org.automatacourse.regex.ast.Alternation;
import org.automatacourse.regex.ast.Ast;
import org.automatacourse.regex.ast.Concat;
import org.automatacourse.regex.ast.Empty;
import org.automatacourse.regex.ast.Literal;
import org.automatacourse.regex.ast.Repetition;
import org.automatacourse.regex.dfa.DfaTable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions into dk.brics automata, so compiled tables can be compared with
 * an independent implementation. dk.brics works on UTF-16 chars, so only
 * symbols of the Basic Multilingual Plane are supported.
 */
public final class ReferenceAutomata {

    private ReferenceAutomata() {
    }

    /** Builds the reference automaton straight from the AST, bypassing the pattern syntax. */
    public static Automaton fromAst(Ast ast) {
        if (ast instanceof Literal) {
            return BasicAutomata.makeChar(toChar(((Literal) ast).getCodePoint()));
        } else if (ast instanceof Concat) {
            List<Ast> asts = ((Concat) ast).getAsts();
            Automaton result = fromAst(asts.get(0));
            for (Ast next : asts.subList(1, asts.size())) {
                result = result.concatenate(fromAst(next));
            }
            return result;
        } else if (ast instanceof Alternation) {
            List<Ast> asts = ((Alternation) ast).getAsts();
            Automaton result = fromAst(asts.get(0));
            for (Ast next : asts.subList(1, asts.size())) {
                result = result.union(fromAst(next));
            }
            return result;
        } else if (ast instanceof Repetition) {
            return fromAst(((Repetition) ast).getAst()).repeat();
        } else if (ast instanceof Empty) {
            return BasicAutomata.makeEmptyString();
        }
        throw new UnsupportedOperationException("Unknown AST node: " + ast.getClass());
    }

    /** One brics state per row; missing transitions stay missing (brics rejects on them too). */
    public static Automaton fromDfaTable(DfaTable dfa) {
        Map<String, State> states = new HashMap<>();
        for (String label : dfa.getTable().keySet()) {
            State state = new State();
            state.setAccept(dfa.isAccepting(label));
            states.put(label, state);
        }
        for (Map.Entry<String, ? extends Map<String, String>> row : dfa.getTable().entrySet()) {
            State from = states.get(row.getKey());
            for (Map.Entry<String, String> transition : row.getValue().entrySet()) {
                String symbol = transition.getKey();
                Preconditions.checkArgument(symbol.length() == 1,
                        "Symbol '%s' is outside the Basic Multilingual Plane", symbol);
                from.addTransition(new Transition(symbol.charAt(0), states.get(transition.getValue())));
            }
        }

        Automaton automaton = new Automaton();
        State initial = states.get(dfa.getStartingState());
        Preconditions.checkState(initial != null, "Starting state %s has no row", dfa.getStartingState());
        automaton.setInitialState(initial);
        automaton.setDeterministic(true);
        return automaton;
    }

    private static char toChar(int codePoint) {
        Preconditions.checkArgument(Character.isBmpCodePoint(codePoint),
                "Code point U+%s is outside the Basic Multilingual Plane", Integer.toHexString(codePoint));
        return (char) codePoint;
    }
}

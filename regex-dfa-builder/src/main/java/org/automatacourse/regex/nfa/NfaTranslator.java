package org.automatacourse.regex.nfa;

import org.automatacourse.regex.ast.Alternation;
import org.automatacourse.regex.ast.Ast;
import org.automatacourse.regex.ast.Concat;
import org.automatacourse.regex.ast.Empty;
import org.automatacourse.regex.ast.Literal;
import org.automatacourse.regex.ast.Repetition;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates an AST into a Thompson NFA fragment, node by node.
 */
public final class NfaTranslator {
    private final NfaBuilder builder;

    public NfaTranslator(NfaBuilder builder) {
        this.builder = builder;
    }

    public static Fragment translate(Ast ast) {
        return new NfaTranslator(new NfaBuilder()).toFragment(ast);
    }

    public Fragment toFragment(Ast ast) {
        if (ast instanceof Literal) {
            return builder.symbol(((Literal) ast).getCodePoint());
        } else if (ast instanceof Concat) {
            return builder.concat(toFragments(((Concat) ast).getAsts()));
        } else if (ast instanceof Alternation) {
            return builder.or(toFragments(((Alternation) ast).getAsts()));
        } else if (ast instanceof Repetition) {
            return builder.rep(toFragment(((Repetition) ast).getAst()));
        } else if (ast instanceof Empty) {
            return builder.empty();
        }
        throw new UnsupportedOperationException("Unknown AST node: " + ast.getClass());
    }

    private List<Fragment> toFragments(List<Ast> asts) {
        List<Fragment> fragments = new ArrayList<>(asts.size());
        for (Ast ast : asts) {
            fragments.add(toFragment(ast));
        }
        return fragments;
    }
}

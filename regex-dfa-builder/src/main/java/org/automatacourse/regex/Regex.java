package org.automatacourse.regex;

import com.google.common.base.Preconditions;
import org.automatacourse.regex.ast.Ast;
import org.automatacourse.regex.ast.Parser;
import org.automatacourse.regex.ast.RegexSyntaxException;
import org.automatacourse.regex.dfa.DfaTable;
import org.automatacourse.regex.dfa.SubsetConstructor;
import org.automatacourse.regex.nfa.Fragment;
import org.automatacourse.regex.nfa.NfaTable;
import org.automatacourse.regex.nfa.NfaTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled regular expression.
 * <p>
 * Compiling runs the whole pipeline once: pattern, AST, Thompson NFA, NFA
 * table, DFA table, minimized DFA table. {@link #test(String)} walks the
 * minimized table. Instances are immutable and can be shared between threads.
 */
public final class Regex {
    private static final Logger LOG = LoggerFactory.getLogger(Regex.class);

    private final String pattern;
    private final CompilerOptions options;
    private final Ast ast;
    private final NfaTable nfaTable;
    private final DfaTable dfaTable;
    private final DfaTable minimizedTable;

    private Regex(String pattern, CompilerOptions options, Ast ast, NfaTable nfaTable,
                  DfaTable dfaTable, DfaTable minimizedTable) {
        this.pattern = pattern;
        this.options = options;
        this.ast = ast;
        this.nfaTable = nfaTable;
        this.dfaTable = dfaTable;
        this.minimizedTable = minimizedTable;
    }

    public static Regex compile(String pattern) throws RegexSyntaxException {
        return compile(pattern, CompilerOptions.defaults());
    }

    public static Regex compile(String pattern, CompilerOptions options) throws RegexSyntaxException {
        Preconditions.checkNotNull(pattern, "pattern");
        Preconditions.checkNotNull(options, "options");

        Ast ast = Parser.parse(pattern);
        LOG.debug("Parsed /{}/ into {}", pattern, ast);

        Fragment fragment = NfaTranslator.translate(ast);
        NfaTable nfaTable = fragment.toTable();
        LOG.debug("NFA table for /{}/ has {} states", pattern, nfaTable.size());

        DfaTable dfaTable = SubsetConstructor.build(nfaTable, options.getConstruction());
        if (options.isSimplifyNotations()) {
            dfaTable.simplifyNotations();
        }

        DfaTable minimizedTable = new DfaTable(dfaTable);
        boolean merged = minimizedTable.minimize(options.getRefinement());
        if (options.isSimplifyNotations()) {
            minimizedTable.simplifyNotations();
        }
        LOG.debug("Compiled /{}/ with {}: {} DFA states, {} after minimization (merged: {})",
                pattern, options, dfaTable.size(), minimizedTable.size(), merged);

        return new Regex(pattern, options, ast, nfaTable, dfaTable, minimizedTable);
    }

    /** Whether the whole {@code input} matches the pattern. */
    public boolean test(String input) {
        return minimizedTable.matches(input);
    }

    public String getPattern() {
        return pattern;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public Ast getAst() {
        return ast;
    }

    public NfaTable getNfaTable() {
        return nfaTable;
    }

    /** The DFA table as built by subset construction (a copy). */
    public DfaTable getDfaTable() {
        return new DfaTable(dfaTable);
    }

    /** The minimized DFA table (a copy). */
    public DfaTable getMinimizedTable() {
        return new DfaTable(minimizedTable);
    }

    @Override
    public String toString() {
        return "/" + pattern + "/";
    }
}

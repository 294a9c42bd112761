package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarError;
import com.viffx.Gnf.Grammar.GrammarException;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Variable;

/**
 * Expands leading variables until every production of a variable starts with a terminal.
 * <p>
 * Callers visit the ordered variables from A<sub>m</sub> down to A<sub>1</sub> and then the
 * helpers in allocation order; every leading variable met is then already terminal-leading and
 * a single round suffices.
 */
public final class BackSubstitution {
    private final Grammar grammar;
    private final LeadingSubstitution substitution;

    BackSubstitution(Grammar grammar, LeadingSubstitution substitution) {
        this.grammar = grammar;
        this.substitution = substitution;
    }

    /**
     * Brings every production of {@code head} to terminal-leading form.
     *
     * @throws GrammarException with {@link GrammarError#NON_TERMINATING_INPUT} if {@code head} leads
     *                          with itself or does not settle within one round per variable
     */
    public void apply(Variable head) {
        int limit = grammar.variablesSize() + 1;
        int rounds = 0;
        while (leadsWithVariable(head)) {
            if (++rounds > limit) {
                throw new GrammarException(GrammarError.NON_TERMINATING_INPUT,
                        head + " still leads with a variable after " + limit + " rounds");
            }
            substitution.substitute(head, leading -> true, Stage.BACK_SUBSTITUTED);
        }
    }

    private boolean leadsWithVariable(Variable head) {
        boolean leads = false;
        for (Production body : grammar.productions(head)) {
            Variable leading = body.leadingVariable();
            if (leading == null) continue;
            if (leading.equals(head)) {
                throw new GrammarException(GrammarError.NON_TERMINATING_INPUT,
                        grammar.toString(head) + " (" + head + " leads with itself)");
            }
            leads = true;
        }
        return leads;
    }
}

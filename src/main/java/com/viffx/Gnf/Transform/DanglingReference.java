package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Variable;

/**
 * A production removed because its leading variable has no entry in the grammar.
 *
 * @param head    the variable the production belonged to
 * @param body    the removed production
 * @param missing the undefined leading variable
 * @param stage   the phase that removed it
 */
public record DanglingReference(Variable head, Production body, Variable missing, Stage stage) {
    @Override
    public String toString() {
        return head + " > " + body + "; (" + missing + " is undefined, dropped during " + stage + ")";
    }
}

package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Symbols.Variable;

/**
 * Removes backward leading references: afterwards no production of A<sub>i</sub> starts with
 * A<sub>j</sub> for j &lt; i.
 * <p>
 * A<sub>1</sub> ... A<sub>i-1</sub> must already be processed (and freed of immediate left
 * recursion) when {@link #apply(int)} runs for i, which is why the normalizer interleaves this
 * phase with {@link LeftRecursionElimination}.
 */
public final class ForwardSubstitution {
    private final VariableOrdering ordering;
    private final LeadingSubstitution substitution;

    ForwardSubstitution(VariableOrdering ordering, LeadingSubstitution substitution) {
        this.ordering = ordering;
        this.substitution = substitution;
    }

    /**
     * Substitutes A<sub>1</sub> ... A<sub>i-1</sub>, in that order, into the leading position of
     * the productions of A<sub>i</sub> (zero-based {@code index}).
     */
    public void apply(int index) {
        Variable head = ordering.get(index);
        for (int j = 0; j < index; j++) {
            Variable earlier = ordering.get(j);
            substitution.substitute(head, earlier::equals, Stage.SUBSTITUTED);
        }
    }
}

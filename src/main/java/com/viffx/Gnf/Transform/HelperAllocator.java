package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Symbols.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out fresh synthetic variables for one normalization run.
 * <p>
 * Indices continue after the highest synthetic index already present. Names already used by a
 * variable of the grammar are skipped.
 */
public final class HelperAllocator {
    public static final String RECURSION_PREFIX = "Z";
    public static final String CARRIER_PREFIX = "T";

    private final Set<String> taken = new HashSet<>();
    private final List<Variable> allocated = new ArrayList<>();
    private int next = 1;

    public HelperAllocator(Grammar grammar) {
        Set<Variable> known = new HashSet<>(grammar.variables());
        known.addAll(grammar.referencedVariables());
        for (Variable variable : known) {
            taken.add(variable.value());
            if (variable.isSynthetic()) next = Math.max(next, variable.order() + 1);
        }
    }

    /**
     * Returns a new synthetic variable named {@code prefix} followed by its index.
     */
    public Variable allocate(String prefix) {
        while (taken.contains(prefix + next)) next++;
        Variable helper = Variable.synthetic(prefix + next, next);
        next++;
        taken.add(helper.value());
        allocated.add(helper);
        return helper;
    }

    /**
     * Returns every variable allocated so far, in allocation order.
     */
    public List<Variable> allocated() {
        return List.copyOf(allocated);
    }
}

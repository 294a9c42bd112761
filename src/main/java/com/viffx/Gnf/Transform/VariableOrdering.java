package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarError;
import com.viffx.Gnf.Grammar.GrammarException;
import com.viffx.Gnf.Symbols.Variable;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The fixed sequence A<sub>1</sub> ... A<sub>m</sub> of the variables a grammar defines when a run starts.
 * <p>
 * Original variables come first, ascending by their ordering value, followed by any synthetic
 * variables the input already holds, ascending by index. Helper variables allocated later in
 * the run are not part of it. Indices are zero based: {@code get(0)} is A<sub>1</sub>.
 */
public final class VariableOrdering {
    private static final Comparator<Variable> POSITION = Comparator
            .comparing(Variable::origin)
            .thenComparingInt(Variable::order);

    private final List<Variable> ascending;
    private final Map<Variable, Integer> positions = new HashMap<>();

    private VariableOrdering(List<Variable> ascending) {
        this.ascending = List.copyOf(ascending);
        for (int i = 0; i < this.ascending.size(); i++) {
            positions.put(this.ascending.get(i), i);
        }
    }

    /**
     * Orders the variables defined by {@code grammar}.
     *
     * @throws GrammarException with {@link GrammarError#DUPLICATE_ORDERING} if two variables share
     *                          an origin and an ordering value
     */
    @NotNull
    public static VariableOrdering of(@NotNull Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        List<Variable> variables = grammar.variables();
        variables.sort(POSITION);

        List<String> clashes = new ArrayList<>();
        for (int i = 1; i < variables.size(); i++) {
            Variable previous = variables.get(i - 1);
            Variable current = variables.get(i);
            if (POSITION.compare(previous, current) == 0) {
                clashes.add(previous + " and " + current + " share " + current.origin() + " order " + current.order());
            }
        }
        if (!clashes.isEmpty()) throw new GrammarException(GrammarError.DUPLICATE_ORDERING, clashes);

        return new VariableOrdering(variables);
    }

    public int size() {
        return ascending.size();
    }

    public Variable get(int index) {
        return ascending.get(index);
    }

    /**
     * Returns the position of {@code variable}, or {@code -1} if it is not part of the ordering.
     */
    public int indexOf(Variable variable) {
        Integer position = positions.get(variable);
        return position == null ? -1 : position;
    }

    public boolean contains(Variable variable) {
        return positions.containsKey(variable);
    }

    public List<Variable> ascending() {
        return ascending;
    }

    public List<Variable> descending() {
        List<Variable> descending = new ArrayList<>(ascending);
        Collections.reverse(descending);
        return descending;
    }

    @Override
    public String toString() {
        return ascending.toString();
    }
}

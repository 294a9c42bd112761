package com.viffx.Gnf.Grammar;

import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Variable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiConsumer;

/**
 * A context-free grammar stored as a mapping from each variable to its set of productions.
 * <p>
 * Production sets are deduplicated and kept in the canonical {@link Production} order.
 * Variables are kept in the order they were defined. A variable whose production set is empty
 * stays in the grammar: it derives nothing, which is a meaningful answer and is rendered as
 * {@code A > ∅;}.
 * <p>
 * Instances are mutable and not thread-safe.
 */
public class Grammar {
    public static final String EMPTY_SET = "∅";

    // ====== INSTANCE FIELDS ====== //
    private final Map<Variable, TreeSet<Production>> rules = new LinkedHashMap<>();

    // ====== CONSTRUCTORS ====== //
    public Grammar() {}

    /**
     * Returns a deep copy of {@code other}. Productions are immutable, so only the sets are copied.
     */
    @NotNull
    @Contract("_ -> new")
    public static Grammar copyOf(@NotNull Grammar other) {
        Objects.requireNonNull(other, "grammar cannot be null");
        Grammar copy = new Grammar();
        other.rules.forEach((variable, productions) -> copy.rules.put(variable, new TreeSet<>(productions)));
        return copy;
    }

    /**
     * Replaces the whole content of this grammar with a copy of {@code other}, keeping the
     * definition order of {@code other}.
     */
    public void assign(@NotNull Grammar other) {
        Objects.requireNonNull(other, "grammar cannot be null");
        if (other == this) return;
        rules.clear();
        other.rules.forEach((variable, productions) -> rules.put(variable, new TreeSet<>(productions)));
    }

    // ====== PUBLIC API ====== //

    // Variables

    /**
     * Adds an entry for {@code variable} with no productions, if it has none yet.
     *
     * @param variable the variable to define
     * @return {@code true} if the variable was not defined before
     */
    public boolean define(@NotNull Variable variable) {
        Objects.requireNonNull(variable, "variable cannot be null");
        if (rules.containsKey(variable)) return false;
        rules.put(variable, new TreeSet<>());
        return true;
    }

    /**
     * Returns whether {@code variable} has an entry, even an empty one.
     */
    public boolean contains(Variable variable) {
        return rules.containsKey(variable);
    }

    /**
     * Returns the defined variables in definition order.
     */
    public List<Variable> variables() {
        return new ArrayList<>(rules.keySet());
    }

    /**
     * Returns the number of defined variables.
     */
    public int variablesSize() {
        return rules.size();
    }

    /**
     * Returns every variable that appears in some production, defined or not, in first-seen order.
     */
    public Set<Variable> referencedVariables() {
        Set<Variable> referenced = new LinkedHashSet<>();
        for (TreeSet<Production> productions : rules.values()) {
            for (Production production : productions) {
                for (Symbol symbol : production) {
                    if (symbol instanceof Variable variable) referenced.add(variable);
                }
            }
        }
        return referenced;
    }

    // Productions

    /**
     * Adds a production to {@code head}, defining {@code head} if needed.
     *
     * @return {@code true} if the production was not already present
     */
    public boolean add(@NotNull Variable head, @NotNull Production production) {
        Objects.requireNonNull(head, "head cannot be null");
        Objects.requireNonNull(production, "production cannot be null");
        return rules.computeIfAbsent(head, variable -> new TreeSet<>()).add(production);
    }

    /**
     * Convenience form of {@link #add(Variable, Production)}.
     */
    public boolean add(@NotNull Variable head, Symbol... symbols) {
        return add(head, Production.of(symbols));
    }

    /**
     * Returns a read-only view of the productions of {@code variable}.
     *
     * @throws IllegalArgumentException if {@code variable} has no entry
     */
    public SortedSet<Production> productions(Variable variable) {
        TreeSet<Production> productions = rules.get(variable);
        if (productions == null) throw new IllegalArgumentException("variable " + variable + " is not defined");
        return Collections.unmodifiableSortedSet(productions);
    }

    /**
     * Replaces the whole production set of {@code variable}, defining it if needed.
     */
    public void replace(@NotNull Variable variable, @NotNull Collection<Production> productions) {
        Objects.requireNonNull(variable, "variable cannot be null");
        Objects.requireNonNull(productions, "productions cannot be null");
        rules.put(variable, new TreeSet<>(productions));
    }

    /**
     * Removes {@code removals} from the production set of {@code variable}, then adds {@code insertions}.
     * Both collections are computed by the caller beforehand, so the set is never changed while
     * it is being scanned.
     *
     * @throws IllegalArgumentException if {@code variable} has no entry
     */
    public void rewrite(Variable variable, Collection<Production> removals, Collection<Production> insertions) {
        TreeSet<Production> productions = rules.get(variable);
        if (productions == null) throw new IllegalArgumentException("variable " + variable + " is not defined");
        productions.removeAll(removals);
        productions.addAll(insertions);
    }

    /**
     * Returns the number of productions of {@code variable}, or {@code 0} when it is undefined.
     */
    public int productionsSize(Variable variable) {
        TreeSet<Production> productions = rules.get(variable);
        return productions == null ? 0 : productions.size();
    }

    /**
     * Returns the total number of productions in the grammar.
     */
    public int productionsSize() {
        int size = 0;
        for (TreeSet<Production> productions : rules.values()) size += productions.size();
        return size;
    }

    /**
     * Applies the given action to every (head, production) pair, variables in definition order
     * and productions in canonical order.
     */
    public void forEachProduction(BiConsumer<Variable, Production> consumer) {
        for (Map.Entry<Variable, TreeSet<Production>> entry : rules.entrySet()) {
            for (Production production : entry.getValue()) {
                consumer.accept(entry.getKey(), production);
            }
        }
    }

    // Rendering

    /**
     * Returns one rule in the loader syntax:
     * <pre>
     *   A > a B | b;
     * </pre>
     *
     * @throws IllegalArgumentException if {@code variable} has no entry
     */
    public String toString(Variable variable) {
        SortedSet<Production> productions = productions(variable);
        StringBuilder builder = new StringBuilder();
        builder.append(variable).append(" > ");
        if (productions.isEmpty()) {
            builder.append(EMPTY_SET);
        }
        int i = 0;
        for (Production production : productions) {
            builder.append(production);
            if (++i < productions.size()) builder.append(" | ");
        }
        return builder.append(";").toString();
    }

    /**
     * Renders every rule, one per line, in definition order. The result can be read back
     * by {@link GrammarLoader#parse(String)}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Variable variable : rules.keySet()) {
            builder.append(toString(variable)).append("\n");
        }
        return builder.toString();
    }

    /**
     * Two grammars are equal when they define the same variables with the same production sets.
     * Definition order is not significant.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Grammar grammar = (Grammar) o;
        return rules.equals(grammar.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }
}

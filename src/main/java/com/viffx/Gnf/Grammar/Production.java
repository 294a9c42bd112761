package com.viffx.Gnf.Grammar;

import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Variable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The right-hand side of a rule: an immutable sequence of symbols.
 * <p>
 * Productions compare lexicographically symbol by symbol, a proper prefix sorting first.
 * The order only exists so production sets render the same way on every run.
 */
public record Production(List<Symbol> symbols) implements Comparable<Production>, Iterable<Symbol> {
    public Production {
        symbols = List.copyOf(Objects.requireNonNull(symbols, "symbols cannot be null"));
    }

    @NotNull
    @Contract("_ -> new")
    public static Production of(Symbol... symbols) {
        return new Production(List.of(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    /**
     * Returns the leading symbol.
     *
     * @throws IndexOutOfBoundsException if the production is empty
     */
    public Symbol first() {
        if (symbols.isEmpty()) throw new IndexOutOfBoundsException("Index 0 out of bounds for length 0");
        return symbols.get(0);
    }

    public boolean startsWith(Symbol symbol) {
        return !symbols.isEmpty() && symbols.get(0).equals(symbol);
    }

    /**
     * Returns the leading symbol as a variable, or {@code null} when the production is empty or
     * starts with a terminal.
     */
    public Variable leadingVariable() {
        if (symbols.isEmpty()) return null;
        return symbols.get(0) instanceof Variable variable ? variable : null;
    }

    /**
     * Returns everything after the leading symbol.
     */
    public Production tail() {
        if (symbols.isEmpty()) throw new IndexOutOfBoundsException("Index 1 out of bounds for length 0");
        return new Production(symbols.subList(1, symbols.size()));
    }

    public Production concat(Production suffix) {
        if (suffix.isEmpty()) return this;
        List<Symbol> joined = new ArrayList<>(symbols.size() + suffix.size());
        joined.addAll(symbols);
        joined.addAll(suffix.symbols);
        return new Production(joined);
    }

    public Production append(Symbol symbol) {
        List<Symbol> joined = new ArrayList<>(symbols.size() + 1);
        joined.addAll(symbols);
        joined.add(symbol);
        return new Production(joined);
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public int compareTo(@NotNull Production other) {
        int shared = Math.min(size(), other.size());
        for (int i = 0; i < shared; i++) {
            int comparison = symbols.get(i).compareTo(other.symbols.get(i));
            if (comparison != 0) return comparison;
        }
        return Integer.compare(size(), other.size());
    }

    /**
     * Renders the symbols separated by single spaces, the body half of the rule syntax.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < symbols.size(); i++) {
            builder.append(symbols.get(i));
            if (i + 1 < symbols.size()) builder.append(" ");
        }
        return builder.toString();
    }
}

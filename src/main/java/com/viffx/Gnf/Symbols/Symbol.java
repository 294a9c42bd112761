package com.viffx.Gnf.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * An entry of a grammar alphabet.
 * <p>
 * Symbols are plain values: two symbols are the same symbol exactly when kind, name, origin
 * and order all match. Their total order compares the same fields in that sequence, which is
 * what keeps production sets and snapshots deterministic.
 */
public sealed interface Symbol extends Comparable<Symbol> permits Terminal, Variable {
    Comparator<Symbol> ORDER = Comparator
            .comparing(Symbol::kind)
            .thenComparing(Symbol::value)
            .thenComparing(Symbol::origin)
            .thenComparingInt(Symbol::order);

    SymbolKind kind();

    String value();

    /**
     * Terminals carry no ordering of their own, they always answer {@code 0}.
     */
    int order();

    Origin origin();

    default boolean isTerminal() {
        return kind() == SymbolKind.TERMINAL;
    }

    default boolean isVariable() {
        return kind() == SymbolKind.VARIABLE;
    }

    @Override
    default int compareTo(@NotNull Symbol other) {
        return ORDER.compare(this, other);
    }
}

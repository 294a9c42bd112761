package com.viffx.Gnf.Symbols;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A grammar variable (non-terminal).
 *
 * @param value  the display name
 * @param origin whether the caller supplied the variable or the normalizer allocated it
 * @param order  for {@link Origin#ORIGINAL} variables the caller's ordering value (A<sub>order</sub>),
 *               for {@link Origin#SYNTHETIC} ones the allocation index
 */
public record Variable(String value, Origin origin, int order) implements Symbol {
    public Variable {
        Objects.requireNonNull(value, "variable name cannot be null");
        Objects.requireNonNull(origin, "variable origin cannot be null");
        if (value.isEmpty()) throw new IllegalArgumentException("variable name cannot be empty");
    }

    @NotNull
    @Contract("_, _ -> new")
    public static Variable original(String value, int order) {
        return new Variable(value, Origin.ORIGINAL, order);
    }

    @NotNull
    @Contract("_, _ -> new")
    public static Variable synthetic(String value, int index) {
        return new Variable(value, Origin.SYNTHETIC, index);
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.VARIABLE;
    }

    public boolean isSynthetic() {
        return origin == Origin.SYNTHETIC;
    }

    @Override
    public String toString() {
        return value;
    }
}

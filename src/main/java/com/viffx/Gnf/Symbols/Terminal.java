package com.viffx.Gnf.Symbols;

import java.util.Objects;
import java.util.regex.Pattern;

public record Terminal(String value) implements Symbol {
    private static final Pattern BARE = Pattern.compile("[a-z0-9][A-Za-z0-9_]*");

    public Terminal {
        Objects.requireNonNull(value, "terminal value cannot be null");
        if (value.isEmpty()) throw new IllegalArgumentException("terminal value cannot be empty");
    }

    @Override
    public SymbolKind kind() {
        return SymbolKind.TERMINAL;
    }

    @Override
    public int order() {
        return 0;
    }

    @Override
    public Origin origin() {
        return Origin.ORIGINAL;
    }

    /**
     * Terminals that would not read back as terminals (punctuation, upper case first letter)
     * are quoted, e.g. {@code '('}.
     */
    @Override
    public String toString() {
        if (BARE.matcher(value).matches()) return value;
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}

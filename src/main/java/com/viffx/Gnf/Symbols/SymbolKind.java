package com.viffx.Gnf.Symbols;

/**
 * The two categories of a grammar alphabet. Declaration order is the comparison order,
 * so every terminal sorts before every variable.
 */
public enum SymbolKind {
    TERMINAL,
    VARIABLE,
}

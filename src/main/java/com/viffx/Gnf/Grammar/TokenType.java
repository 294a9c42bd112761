package com.viffx.Gnf.Grammar;

public enum TokenType {
    VARIABLE,   // upper case first letter, e.g. A1, Expr
    TERMINAL,   // lower case or digit first, e.g. a, if, 0; or quoted, e.g. '('
    SYMBOL,     // one of > | ;
    EMPTY_SET,  // ∅, a rule with no productions
    EOF,
}

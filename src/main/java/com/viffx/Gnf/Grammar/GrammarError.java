package com.viffx.Gnf.Grammar;

/**
 * Grammar-level problems reported through {@link GrammarException}.
 */
public enum GrammarError {
    /** Two variables share the same origin and ordering value. */
    DUPLICATE_ORDERING,
    /** A production references a variable that has no entry in the grammar. */
    DANGLING_REFERENCE,
    /** A production has no symbols. */
    EMPTY_BODY,
    /** Back substitution could not bring a variable to terminal-leading form. */
    NON_TERMINATING_INPUT,
    /** A variable's production set grew past the configured cap. */
    PRODUCTION_LIMIT_EXCEEDED,
}

package com.viffx.Gnf.Transform;

/**
 * Points in a normalization run at which the grammar can be snapshotted.
 */
public enum Stage {
    /** The input, once its variable ordering has been established. */
    ORDERED,
    /** After forward substitution and left-recursion elimination of every ordered variable. */
    SUBSTITUTED,
    /** After back substitution: every production starts with a terminal. */
    BACK_SUBSTITUTED,
    /** After non-leading terminals were replaced with carrier variables. */
    LIFTED,
}

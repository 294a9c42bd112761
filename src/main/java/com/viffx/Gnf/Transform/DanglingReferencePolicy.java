package com.viffx.Gnf.Transform;

/**
 * What the normalizer does with productions that lead with a variable the grammar does not define.
 */
public enum DanglingReferencePolicy {
    /**
     * Remove the production without a replacement and record a {@link DanglingReference}.
     * The variable's language shrinks by whatever that production contributed.
     */
    DROP,
    /**
     * Refuse to run when any production mentions an undefined variable.
     */
    REJECT,
}

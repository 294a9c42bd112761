package com.viffx.Gnf.Symbols;

/**
 * Where a {@link Variable} comes from.
 * <ul>
 *   <li>{@link #ORIGINAL} - supplied by the caller, its order is the caller's ordering value</li>
 *   <li>{@link #SYNTHETIC} - allocated while normalizing, its order is the allocation index</li>
 * </ul>
 */
public enum Origin {
    ORIGINAL,
    SYNTHETIC,
}

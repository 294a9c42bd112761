package com.viffx.Gnf.Grammar;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a grammar cannot be normalized. Carries the error category and every offending
 * item found, rendered as text, so one report names all of them instead of only the first.
 */
public class GrammarException extends IllegalArgumentException {
    private final GrammarError error;
    private final List<String> offenders;

    public GrammarException(GrammarError error, List<String> offenders) {
        super(message(error, offenders));
        this.error = Objects.requireNonNull(error, "error cannot be null");
        this.offenders = List.copyOf(offenders);
    }

    public GrammarException(GrammarError error, String offender) {
        this(error, List.of(offender));
    }

    public GrammarError error() {
        return error;
    }

    public List<String> offenders() {
        return offenders;
    }

    private static String message(GrammarError error, List<String> offenders) {
        StringBuilder builder = new StringBuilder();
        builder.append(error).append(":");
        for (String offender : offenders) {
            builder.append("\n\t\t").append(offender);
        }
        return builder.toString();
    }
}

package com.viffx.Gnf.Transform;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Settings of a {@link GreibachNormalizer}.
 *
 * @param danglingReferences        how undefined leading variables are treated
 * @param liftTerminals             whether non-leading terminals are replaced with carrier variables,
 *                                  giving the strict {@code a V*} shape
 * @param captureSnapshots          whether the grammar is rendered at every {@link Stage}
 * @param maxProductionsPerVariable cap on the size of any single production set
 */
public record NormalizerOptions(DanglingReferencePolicy danglingReferences,
                                boolean liftTerminals,
                                boolean captureSnapshots,
                                int maxProductionsPerVariable) {
    public static final int DEFAULT_MAX_PRODUCTIONS = 100_000;

    public NormalizerOptions {
        Objects.requireNonNull(danglingReferences, "danglingReferences cannot be null");
        if (maxProductionsPerVariable < 1) {
            throw new IllegalArgumentException("maxProductionsPerVariable must be positive, got " + maxProductionsPerVariable);
        }
    }

    @NotNull
    @Contract("-> new")
    public static NormalizerOptions defaults() {
        return new NormalizerOptions(DanglingReferencePolicy.DROP, true, false, DEFAULT_MAX_PRODUCTIONS);
    }

    public NormalizerOptions withDanglingReferences(DanglingReferencePolicy policy) {
        return new NormalizerOptions(policy, liftTerminals, captureSnapshots, maxProductionsPerVariable);
    }

    public NormalizerOptions withLiftTerminals(boolean lift) {
        return new NormalizerOptions(danglingReferences, lift, captureSnapshots, maxProductionsPerVariable);
    }

    public NormalizerOptions withCaptureSnapshots(boolean capture) {
        return new NormalizerOptions(danglingReferences, liftTerminals, capture, maxProductionsPerVariable);
    }

    public NormalizerOptions withMaxProductionsPerVariable(int max) {
        return new NormalizerOptions(danglingReferences, liftTerminals, captureSnapshots, max);
    }
}

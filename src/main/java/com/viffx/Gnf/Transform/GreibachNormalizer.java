package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarError;
import com.viffx.Gnf.Grammar.GrammarException;
import com.viffx.Gnf.Symbols.Variable;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts context-free grammars without empty productions to Greibach Normal Form.
 * <p>
 * The run proceeds in phases:
 * <ol>
 *   <li>the defined variables are put in their fixed order A<sub>1</sub> ... A<sub>m</sub>
 *       ({@link VariableOrdering});</li>
 *   <li>for i = 1 ... m, productions of A<sub>i</sub> led by A<sub>j</sub>, j &lt; i, are expanded
 *       ({@link ForwardSubstitution}) and the immediate left recursion of A<sub>i</sub> is moved
 *       into a helper variable ({@link LeftRecursionElimination});</li>
 *   <li>A<sub>m</sub> ... A<sub>1</sub> and then the helpers are expanded until every production
 *       starts with a terminal ({@link BackSubstitution});</li>
 *   <li>optionally, terminals after the first position are replaced with carrier variables
 *       ({@link TerminalLifting}).</li>
 * </ol>
 * The rewrites run on a working copy that is written back to the caller's grammar only when the
 * run succeeds, so a failed run leaves its input untouched.
 * <p>
 * A normalizer keeps no state between runs and can be shared by threads working on different
 * grammars.
 */
public final class GreibachNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(GreibachNormalizer.class);

    private final NormalizerOptions options;

    public GreibachNormalizer() {
        this(NormalizerOptions.defaults());
    }

    public GreibachNormalizer(@NotNull NormalizerOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /**
     * Normalizes {@code grammar} in place. If the run fails, {@code grammar} is left as it was.
     *
     * @param grammar the grammar to rewrite
     * @return the rewritten grammar along with the run's ordering, helpers and diagnostics
     * @throws GrammarException if the grammar has empty productions, a duplicate ordering, undefined
     *                          variables under {@link DanglingReferencePolicy#REJECT}, or grows past
     *                          the configured production cap
     */
    @NotNull
    public NormalizationResult normalize(@NotNull Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        rejectEmptyProductions(grammar);
        VariableOrdering ordering = VariableOrdering.of(grammar);
        if (options.danglingReferences() == DanglingReferencePolicy.REJECT) rejectUndefinedVariables(grammar);

        Grammar working = Grammar.copyOf(grammar);
        logger.debug("Ordering: {}", ordering);
        Map<Stage, String> snapshots = new EnumMap<>(Stage.class);
        capture(snapshots, Stage.ORDERED, working);

        List<DanglingReference> dropped = new ArrayList<>();
        HelperAllocator allocator = new HelperAllocator(working);
        LeadingSubstitution substitution = new LeadingSubstitution(working, options, dropped);

        // forward substitution, each variable freed of left recursion before the next one
        ForwardSubstitution forward = new ForwardSubstitution(ordering, substitution);
        LeftRecursionElimination recursion = new LeftRecursionElimination(working, allocator);
        List<Variable> recursionHelpers = new ArrayList<>();
        for (int i = 0; i < ordering.size(); i++) {
            forward.apply(i);
            Variable helper = recursion.apply(ordering.get(i));
            if (helper != null) recursionHelpers.add(helper);
        }
        capture(snapshots, Stage.SUBSTITUTED, working);

        BackSubstitution back = new BackSubstitution(working, substitution);
        for (Variable variable : ordering.descending()) {
            back.apply(variable);
        }
        for (Variable helper : recursionHelpers) {
            back.apply(helper);
        }
        capture(snapshots, Stage.BACK_SUBSTITUTED, working);

        if (options.liftTerminals()) {
            new TerminalLifting(working, allocator).apply();
        }
        capture(snapshots, Stage.LIFTED, working);

        grammar.assign(working);
        logger.info("Normalized {} variable(s) into {} production(s) with {} helper(s), {} production(s) dropped",
                ordering.size(), grammar.productionsSize(), allocator.allocated().size(), dropped.size());
        return new NormalizationResult(grammar, ordering, allocator.allocated(), dropped, snapshots);
    }

    /**
     * Normalizes a copy of {@code grammar}, leaving the argument untouched.
     */
    @NotNull
    public NormalizationResult normalizeCopy(@NotNull Grammar grammar) {
        return normalize(Grammar.copyOf(grammar));
    }

    // ====== VALIDATION ====== //
    private static void rejectEmptyProductions(Grammar grammar) {
        List<String> empty = new ArrayList<>();
        grammar.forEachProduction((head, body) -> {
            if (body.isEmpty()) empty.add(head + " > ε");
        });
        if (!empty.isEmpty()) throw new GrammarException(GrammarError.EMPTY_BODY, empty);
    }

    private static void rejectUndefinedVariables(Grammar grammar) {
        List<String> undefined = new ArrayList<>();
        for (Variable variable : grammar.referencedVariables()) {
            if (!grammar.contains(variable)) undefined.add(variable + " is referenced but not defined");
        }
        if (!undefined.isEmpty()) throw new GrammarException(GrammarError.DANGLING_REFERENCE, undefined);
    }

    private void capture(Map<Stage, String> snapshots, Stage stage, Grammar grammar) {
        if (!options.captureSnapshots()) return;
        String rendered = grammar.toString();
        snapshots.put(stage, rendered);
        logger.debug("{}:\n{}", stage, rendered);
    }
}

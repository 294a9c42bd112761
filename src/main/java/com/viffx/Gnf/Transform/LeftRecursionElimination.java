package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns immediate left recursion into right recursion through a fresh helper variable.
 * <pre>
 *   A > A α1 | ... | A αn | β1 | ... | βm;
 * </pre>
 * becomes
 * <pre>
 *   A > β1 | ... | βm | β1 Z | ... | βm Z;
 *   Z > α1 | ... | αn | α1 Z | ... | αn Z;
 * </pre>
 * A production consisting of {@code A} alone adds nothing to the language and is discarded.
 */
public final class LeftRecursionElimination {
    private static final Logger logger = LoggerFactory.getLogger(LeftRecursionElimination.class);

    private final Grammar grammar;
    private final HelperAllocator allocator;

    public LeftRecursionElimination(Grammar grammar, HelperAllocator allocator) {
        this.grammar = grammar;
        this.allocator = allocator;
    }

    /**
     * Removes the immediate left recursion of {@code head}.
     *
     * @return the helper variable introduced, or {@code null} if {@code head} needed none
     */
    public Variable apply(Variable head) {
        List<Production> alphas = new ArrayList<>();
        List<Production> betas = new ArrayList<>();
        boolean selfLoop = false;
        for (Production body : grammar.productions(head)) {
            if (!body.startsWith(head)) {
                betas.add(body);
            } else if (body.size() == 1) {
                selfLoop = true;
            } else {
                alphas.add(body.tail());
            }
        }

        if (alphas.isEmpty()) {
            if (selfLoop) {
                logger.debug("{}: discarding unit self-loop", head);
                grammar.replace(head, betas);
            }
            return null;
        }

        Variable helper = allocator.allocate(HelperAllocator.RECURSION_PREFIX);

        List<Production> rewritten = new ArrayList<>(betas.size() * 2);
        for (Production beta : betas) {
            rewritten.add(beta);
            rewritten.add(beta.append(helper));
        }
        List<Production> repetitions = new ArrayList<>(alphas.size() * 2);
        for (Production alpha : alphas) {
            repetitions.add(alpha);
            repetitions.add(alpha.append(helper));
        }
        grammar.replace(head, rewritten);
        grammar.replace(helper, repetitions);

        logger.debug("{}: {} left-recursive production(s) moved to {}", head, alphas.size(), helper);
        return helper;
    }
}

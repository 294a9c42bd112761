package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarError;
import com.viffx.Gnf.Grammar.GrammarException;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The rewrite shared by forward and back substitution: a production {@code B tail} whose leading
 * variable {@code B} is selected is replaced by {@code ρ tail} for every current production
 * {@code ρ} of {@code B}.
 * <p>
 * Each call scans first and applies afterwards, so the set being rewritten is never modified
 * while it is read.
 */
final class LeadingSubstitution {
    private static final Logger logger = LoggerFactory.getLogger(LeadingSubstitution.class);

    private final Grammar grammar;
    private final int maxProductions;
    private final List<DanglingReference> dropped;

    LeadingSubstitution(Grammar grammar, NormalizerOptions options, List<DanglingReference> dropped) {
        this.grammar = grammar;
        this.maxProductions = options.maxProductionsPerVariable();
        this.dropped = dropped;
    }

    /**
     * Expands every production of {@code head} whose leading variable matches {@code selector}.
     * Productions led by an undefined variable are dropped and recorded.
     *
     * @return whether any production of {@code head} was rewritten
     * @throws GrammarException with {@link GrammarError#PRODUCTION_LIMIT_EXCEEDED} if the result
     *                          would exceed the configured cap
     */
    boolean substitute(Variable head, Predicate<Variable> selector, Stage stage) {
        List<Production> removals = new ArrayList<>();
        List<Production> insertions = new ArrayList<>();
        for (Production body : grammar.productions(head)) {
            Variable leading = body.leadingVariable();
            if (leading == null || !selector.test(leading)) continue;
            removals.add(body);

            if (!grammar.contains(leading)) {
                DanglingReference reference = new DanglingReference(head, body, leading, stage);
                logger.warn("Dropping {}", reference);
                dropped.add(reference);
                continue;
            }

            Production tail = body.tail();
            for (Production expansion : grammar.productions(leading)) {
                insertions.add(expansion.concat(tail));
            }
            if (insertions.size() > maxProductions) throw limitExceeded(head, insertions.size());
        }
        if (removals.isEmpty()) return false;

        grammar.rewrite(head, removals, insertions);
        int size = grammar.productionsSize(head);
        if (size > maxProductions) throw limitExceeded(head, size);
        logger.debug("{}: expanded {} production(s) of {} into {}", stage, removals.size(), head, insertions.size());
        return true;
    }

    private GrammarException limitExceeded(Variable head, int size) {
        return new GrammarException(GrammarError.PRODUCTION_LIMIT_EXCEEDED,
                head + " reached " + size + " productions (limit " + maxProductions + ")");
    }
}

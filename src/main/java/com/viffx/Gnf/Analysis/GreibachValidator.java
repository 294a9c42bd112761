package com.viffx.Gnf.Analysis;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern-matches production shapes against Greibach Normal Form.
 * <p>
 * The lenient check only asks that every production start with a terminal. The strict check
 * additionally requires the rest of the production to be variables that the grammar defines,
 * i.e. the {@code a V*} shape.
 */
public final class GreibachValidator {
    public record Violation(Variable head, Production body, String reason) {
        @Override
        public String toString() {
            return head + " > " + body + "; " + reason;
        }
    }

    private GreibachValidator() {}

    public static List<Violation> violations(Grammar grammar, boolean strict) {
        List<Violation> violations = new ArrayList<>();
        grammar.forEachProduction((head, body) -> {
            if (body.isEmpty()) {
                violations.add(new Violation(head, body, "empty production"));
                return;
            }
            if (!body.first().isTerminal()) {
                violations.add(new Violation(head, body, "starts with variable " + body.first()));
            }
            if (!strict) return;
            for (int i = 1; i < body.size(); i++) {
                Symbol symbol = body.get(i);
                if (symbol.isTerminal()) {
                    violations.add(new Violation(head, body, "terminal " + symbol + " at position " + i));
                } else if (!grammar.contains((Variable) symbol)) {
                    violations.add(new Violation(head, body, "undefined variable " + symbol));
                }
            }
        });
        return violations;
    }

    /**
     * Returns whether every production has the strict {@code a V*} shape.
     */
    public static boolean isGreibach(Grammar grammar) {
        return violations(grammar, true).isEmpty();
    }

    /**
     * Returns whether every production is non-empty and starts with a terminal.
     */
    public static boolean isTerminalLeading(Grammar grammar) {
        return violations(grammar, false).isEmpty();
    }
}

package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Terminal;
import com.viffx.Gnf.Symbols.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Replaces every terminal after the first position with a carrier variable deriving exactly that
 * terminal, turning {@code A > a B c;} into {@code A > a B T1; T1 > c;}.
 * <p>
 * One carrier serves each terminal. A variable of the grammar whose only production is that
 * single terminal is used as its carrier before a new one is allocated.
 */
public final class TerminalLifting {
    private static final Logger logger = LoggerFactory.getLogger(TerminalLifting.class);

    private final Grammar grammar;
    private final HelperAllocator allocator;
    private final Map<Terminal, Variable> carriers = new HashMap<>();

    public TerminalLifting(Grammar grammar, HelperAllocator allocator) {
        this.grammar = grammar;
        this.allocator = allocator;
    }

    /**
     * Lifts the non-leading terminals of every production.
     *
     * @return the number of productions rewritten
     */
    public int apply() {
        List<Variable> variables = grammar.variables();
        for (Variable variable : variables) {
            SortedSet<Production> productions = grammar.productions(variable);
            if (productions.size() == 1 && productions.first().size() == 1
                    && productions.first().first() instanceof Terminal terminal) {
                carriers.putIfAbsent(terminal, variable);
            }
        }

        int rewritten = 0;
        for (Variable variable : variables) {
            List<Production> removals = new ArrayList<>();
            List<Production> insertions = new ArrayList<>();
            for (Production body : grammar.productions(variable)) {
                if (!hasTrailingTerminal(body)) continue;
                removals.add(body);
                insertions.add(lift(body));
            }
            if (removals.isEmpty()) continue;
            grammar.rewrite(variable, removals, insertions);
            rewritten += removals.size();
        }
        logger.debug("Lifted trailing terminals of {} production(s) using {} carrier(s)", rewritten, carriers.size());
        return rewritten;
    }

    private static boolean hasTrailingTerminal(Production body) {
        for (int i = 1; i < body.size(); i++) {
            if (body.get(i).isTerminal()) return true;
        }
        return false;
    }

    private Production lift(Production body) {
        List<Symbol> symbols = new ArrayList<>(body.size());
        symbols.add(body.get(0));
        for (int i = 1; i < body.size(); i++) {
            Symbol symbol = body.get(i);
            symbols.add(symbol instanceof Terminal terminal ? carrier(terminal) : symbol);
        }
        return new Production(symbols);
    }

    private Variable carrier(Terminal terminal) {
        Variable carrier = carriers.get(terminal);
        if (carrier != null) return carrier;
        carrier = allocator.allocate(HelperAllocator.CARRIER_PREFIX);
        grammar.add(carrier, Production.of(terminal));
        carriers.put(terminal, carrier);
        return carrier;
    }
}

package com.viffx.Gnf.Analysis;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.Production;
import com.viffx.Gnf.Symbols.Symbol;
import com.viffx.Gnf.Symbols.Variable;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Enumerates every terminal string of bounded length a variable derives.
 * <p>
 * Leftmost derivations are explored breadth first. Without empty productions a sentential form
 * never shrinks, so forms longer than the bound are pruned and the search is finite. Comparing
 * the sets before and after a rewrite is a brute-force check that the rewrite kept the language.
 */
public final class BoundedLanguage {
    private BoundedLanguage() {}

    /**
     * Returns the strings of at most {@code maxLength} terminals derivable from {@code start},
     * each rendered as the concatenation of its terminal values.
     *
     * @throws IllegalArgumentException if the grammar has an empty production or {@code maxLength} is negative
     */
    @NotNull
    public static Set<String> strings(@NotNull Grammar grammar, @NotNull Variable start, int maxLength) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        Objects.requireNonNull(start, "start cannot be null");
        if (maxLength < 0) throw new IllegalArgumentException("maxLength cannot be negative: " + maxLength);
        grammar.forEachProduction((head, body) -> {
            if (body.isEmpty()) throw new IllegalArgumentException(head + " has an empty production");
        });

        Set<String> words = new TreeSet<>();
        Set<List<Symbol>> seen = new HashSet<>();
        Deque<List<Symbol>> pending = new ArrayDeque<>();
        List<Symbol> initial = List.of(start);
        seen.add(initial);
        pending.add(initial);

        while (!pending.isEmpty()) {
            List<Symbol> form = pending.poll();
            int position = leftmostVariable(form);
            if (position < 0) {
                words.add(render(form));
                continue;
            }

            Variable variable = (Variable) form.get(position);
            if (!grammar.contains(variable)) continue;
            for (Production production : grammar.productions(variable)) {
                if (form.size() - 1 + production.size() > maxLength) continue;
                List<Symbol> next = new ArrayList<>(form.size() - 1 + production.size());
                next.addAll(form.subList(0, position));
                next.addAll(production.symbols());
                next.addAll(form.subList(position + 1, form.size()));
                if (seen.add(next)) pending.add(next);
            }
        }
        return words;
    }

    private static int leftmostVariable(List<Symbol> form) {
        for (int i = 0; i < form.size(); i++) {
            if (form.get(i).isVariable()) return i;
        }
        return -1;
    }

    private static String render(List<Symbol> form) {
        StringBuilder builder = new StringBuilder();
        for (Symbol symbol : form) builder.append(symbol.value());
        return builder.toString();
    }
}

package com.viffx.Gnf.Grammar;

import com.viffx.Gnf.Symbols.Terminal;
import com.viffx.Gnf.Symbols.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarTest {
    private final Terminal a = new Terminal("a");
    private final Terminal b = new Terminal("b");
    private final Variable A = Variable.original("A", 1);
    private final Variable B = Variable.original("B", 2);

    @Test
    void shouldDeduplicateAndOrderProductionsCanonically() {
        Grammar grammar = new Grammar();
        grammar.add(A, B, a);
        grammar.add(A, b);
        grammar.add(A, a);
        grammar.add(A, B, a);

        assertThat(grammar.productions(A)).containsExactly(Production.of(a), Production.of(b), Production.of(B, a));
        assertThat(grammar.toString(A)).isEqualTo("A > a | b | B a;");
        assertThat(grammar.productionsSize()).isEqualTo(3);
    }

    @Test
    void shouldKeepVariablesWithoutProductions() {
        Grammar grammar = new Grammar();
        assertThat(grammar.define(A)).isTrue();
        assertThat(grammar.define(A)).isFalse();

        assertThat(grammar.contains(A)).isTrue();
        assertThat(grammar.productions(A)).isEmpty();
        assertThat(grammar).hasToString("A > ∅;\n");
    }

    @Test
    void shouldRejectProductionsOfUndefinedVariable() {
        Grammar grammar = new Grammar();

        assertThatThrownBy(() -> grammar.productions(A)).isInstanceOf(IllegalArgumentException.class);
        assertThat(grammar.productionsSize(A)).isZero();
    }

    @Test
    void shouldReportReferencedVariablesWhetherDefinedOrNot() {
        Grammar grammar = new Grammar();
        grammar.add(A, a, B);
        grammar.add(A, A, b);

        assertThat(grammar.referencedVariables()).containsExactlyInAnyOrder(A, B);
        assertThat(grammar.variables()).containsExactly(A);
    }

    @Test
    void shouldApplyRemovalsBeforeInsertions() {
        Grammar grammar = new Grammar();
        grammar.add(A, B, a);
        grammar.add(A, b);

        grammar.rewrite(A, List.of(Production.of(B, a), Production.of(b)), List.of(Production.of(b), Production.of(a, a)));

        assertThat(grammar.productions(A)).containsExactly(Production.of(a, a), Production.of(b));
    }

    @Test
    void shouldCopyProductionSetsIndependently() {
        Grammar grammar = new Grammar();
        grammar.add(A, a);
        Grammar copy = Grammar.copyOf(grammar);

        copy.add(A, b);
        copy.add(B, a);

        assertThat(grammar.productions(A)).containsExactly(Production.of(a));
        assertThat(grammar.contains(B)).isFalse();
        assertThat(copy).isNotEqualTo(grammar);
    }

    @Test
    void shouldAssignContentAndDefinitionOrderOfOtherGrammar() {
        Grammar target = new Grammar();
        target.add(A, a);
        Grammar source = new Grammar();
        source.add(B, b);
        source.add(A, B, a);

        target.assign(source);
        source.add(B, a);

        assertThat(target.variables()).containsExactly(B, A);
        assertThat(target.productions(B)).containsExactly(Production.of(b));
        assertThat(target.toString()).isEqualTo("B > b;\nA > B a;\n");
    }

    @Test
    void shouldIgnoreDefinitionOrderInEquality() {
        Grammar first = new Grammar();
        first.add(A, a);
        first.add(B, b);
        Grammar second = new Grammar();
        second.add(B, b);
        second.add(A, a);

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.variables()).containsExactly(A, B);
        assertThat(second.variables()).containsExactly(B, A);
    }

    @Test
    void shouldExposeReadOnlyProductionView() {
        Grammar grammar = new Grammar();
        grammar.add(A, a);

        assertThatThrownBy(() -> grammar.productions(A).add(Production.of(b)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

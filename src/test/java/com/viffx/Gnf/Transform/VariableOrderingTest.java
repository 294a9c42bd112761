package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarError;
import com.viffx.Gnf.Grammar.GrammarException;
import com.viffx.Gnf.Symbols.Terminal;
import com.viffx.Gnf.Symbols.Variable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariableOrderingTest {
    private final Terminal a = new Terminal("a");

    @Test
    void shouldSortByOrderingValueRegardlessOfDefinitionOrder() {
        Variable c = Variable.original("C", 3);
        Variable x = Variable.original("X", 1);
        Variable b = Variable.original("B", 2);
        Grammar grammar = new Grammar();
        grammar.add(c, a);
        grammar.add(x, a);
        grammar.add(b, a);

        VariableOrdering ordering = VariableOrdering.of(grammar);

        assertThat(ordering.ascending()).containsExactly(x, b, c);
        assertThat(ordering.descending()).containsExactly(c, b, x);
        assertThat(ordering.indexOf(b)).isEqualTo(1);
        assertThat(ordering.get(0)).isEqualTo(x);
    }

    @Test
    void shouldPlaceExistingSyntheticVariablesAfterOriginalOnes() {
        Variable z = Variable.synthetic("Z1", 1);
        Variable s = Variable.original("S", 7);
        Grammar grammar = new Grammar();
        grammar.add(z, a);
        grammar.add(s, a, z);

        assertThat(VariableOrdering.of(grammar).ascending()).containsExactly(s, z);
    }

    @Test
    void shouldCoverOnlyDefinedVariables() {
        Variable s = Variable.original("S", 1);
        Variable undefined = Variable.original("B", 2);
        Grammar grammar = new Grammar();
        grammar.add(s, undefined, a);

        VariableOrdering ordering = VariableOrdering.of(grammar);

        assertThat(ordering.size()).isEqualTo(1);
        assertThat(ordering.contains(undefined)).isFalse();
        assertThat(ordering.indexOf(undefined)).isEqualTo(-1);
    }

    @Test
    void shouldRejectDuplicateOrderingValues() {
        Grammar grammar = new Grammar();
        grammar.add(Variable.original("A", 1), a);
        grammar.add(Variable.original("B", 1), a);
        grammar.add(Variable.original("C", 2), a);

        assertThatThrownBy(() -> VariableOrdering.of(grammar))
                .isInstanceOfSatisfying(GrammarException.class, exception -> {
                    assertThat(exception.error()).isEqualTo(GrammarError.DUPLICATE_ORDERING);
                    assertThat(exception.offenders()).containsExactly("A and B share ORIGINAL order 1");
                });
    }
}

package com.viffx.Gnf.Grammar;

import com.viffx.Gnf.Symbols.Terminal;
import com.viffx.Gnf.Symbols.Variable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductionTest {
    private final Terminal a = new Terminal("a");
    private final Terminal b = new Terminal("b");
    private final Variable A = Variable.original("A", 1);
    private final Variable B = Variable.original("B", 2);

    @Test
    void shouldSortPrefixBeforeLongerProduction() {
        assertThat(Production.of(a).compareTo(Production.of(a, b))).isNegative();
        assertThat(Production.of(a, B).compareTo(Production.of(b))).isNegative();
        assertThat(Production.of(b).compareTo(Production.of(A))).isNegative();
        assertThat(Production.of(a, A).compareTo(Production.of(a, A))).isZero();
    }

    @Test
    void shouldSplitAndJoin() {
        Production production = Production.of(A, a, B);

        assertThat(production.first()).isEqualTo(A);
        assertThat(production.leadingVariable()).isEqualTo(A);
        assertThat(production.tail().symbols()).containsExactly(a, B);
        assertThat(Production.of(b).concat(production.tail()).symbols()).containsExactly(b, a, B);
        assertThat(Production.of(b).append(A).symbols()).containsExactly(b, A);
        assertThat(Production.of(b).concat(Production.of()).symbols()).containsExactly(b);
    }

    @Test
    void shouldReportNoLeadingVariableForTerminalLeadOrEmpty() {
        assertThat(Production.of(a, A).leadingVariable()).isNull();
        assertThat(Production.of().leadingVariable()).isNull();
        assertThat(Production.of().startsWith(a)).isFalse();
    }

    @Test
    void shouldRejectFirstAndTailOfEmptyProduction() {
        assertThatThrownBy(() -> Production.of().first()).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Production.of().tail()).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void shouldRenderSymbolsSeparatedBySpaces() {
        assertThat(Production.of(a, A, new Terminal(")")).toString()).isEqualTo("a A ')'");
    }
}

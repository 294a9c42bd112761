package com.viffx.Gnf.Symbols;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolTest {

    @Test
    void shouldSortTerminalsBeforeVariables() {
        Terminal z = new Terminal("z");
        Variable a = Variable.original("A", 1);

        assertThat(z.compareTo(a)).isNegative();
        assertThat(a.compareTo(z)).isPositive();
    }

    @Test
    void shouldCompareByNameThenOriginThenOrder() {
        Variable a2 = Variable.original("A", 2);
        Variable b1 = Variable.original("B", 1);
        Variable a1 = Variable.original("A", 1);
        Variable syntheticA1 = Variable.synthetic("A", 1);

        TreeSet<Symbol> sorted = new TreeSet<>(List.of(b1, syntheticA1, a2, a1));

        assertThat(sorted).containsExactly(a1, a2, syntheticA1, b1);
    }

    @Test
    void shouldTreatSameNameOfDifferentKindAsDistinct() {
        Terminal terminal = new Terminal("a");
        Variable variable = Variable.original("a", 1);

        assertThat(terminal).isNotEqualTo(variable);
        assertThat(terminal.compareTo(variable)).isNotZero();
    }

    @Test
    void shouldUseStructuralEquality() {
        assertThat(Variable.original("A", 1)).isEqualTo(Variable.original("A", 1));
        assertThat(Variable.original("A", 1)).isNotEqualTo(Variable.original("A", 2));
        assertThat(Variable.original("Z1", 1)).isNotEqualTo(Variable.synthetic("Z1", 1));
        assertThat(new Terminal("a")).isEqualTo(new Terminal("a"));
    }

    @Test
    void shouldGiveTerminalsNoOrder() {
        Terminal terminal = new Terminal("a");

        assertThat(terminal.order()).isZero();
        assertThat(terminal.kind()).isEqualTo(SymbolKind.TERMINAL);
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(terminal.isVariable()).isFalse();
    }

    @Test
    void shouldQuoteTerminalsThatWouldNotReadBackAsTerminals() {
        assertThat(new Terminal("a")).hasToString("a");
        assertThat(new Terminal("id_2")).hasToString("id_2");
        assertThat(new Terminal("(")).hasToString("'('");
        assertThat(new Terminal("If")).hasToString("'If'");
        assertThat(new Terminal("it's")).hasToString("'it\\'s'");
    }

    @Test
    void shouldRejectEmptyNames() {
        assertThatThrownBy(() -> new Terminal("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Variable.original("", 1)).isInstanceOf(IllegalArgumentException.class);
    }
}

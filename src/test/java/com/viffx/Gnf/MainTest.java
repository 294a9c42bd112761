package com.viffx.Gnf;

import com.viffx.Gnf.Grammar.GrammarLoader;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static String report(String rules) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            Main.report(GrammarLoader.parse(rules), out);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintEveryStageAndVerdict() throws Exception {
        String output = report("A1 > A2 A3; A2 > A3 A1 | b; A3 > A1 A2 | a;");

        assertThat(output).contains("== ORDERED ==", "== SUBSTITUTED ==", "== BACK_SUBSTITUTED ==", "== LIFTED ==");
        assertThat(output).contains("A1 > A2 A3;");
        assertThat(output).contains("Greibach Normal Form: Pass");
        assertThat(output).doesNotContain("dropped:");
    }

    @Test
    void shouldListDroppedProductions() throws Exception {
        String output = report("A > B c | d;");

        assertThat(output).contains("dropped: A > B c; (B is undefined, dropped during BACK_SUBSTITUTED)");
        assertThat(output).contains("Greibach Normal Form: Pass");
    }

    @Test
    void shouldLoadBundledExample() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            Main.report(GrammarLoader.load(Path.of(Main.DEFAULT_GRAMMAR)), out);
        }

        assertThat(bytes.toString(StandardCharsets.UTF_8)).contains("Greibach Normal Form: Pass");
    }
}

package com.viffx.Gnf;

import com.viffx.Gnf.Analysis.GreibachValidator;
import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Grammar.GrammarLoader;
import com.viffx.Gnf.Transform.DanglingReference;
import com.viffx.Gnf.Transform.GreibachNormalizer;
import com.viffx.Gnf.Transform.NormalizationResult;
import com.viffx.Gnf.Transform.NormalizerOptions;
import com.viffx.Gnf.Transform.Stage;

import java.io.PrintStream;
import java.nio.file.Path;

public class Main {
    public static final String DEFAULT_GRAMMAR = "src/main/resources/WorkedExample.cfg";

    public static void main(String[] args) throws Exception {
        Path path = Path.of(args.length > 0 ? args[0] : DEFAULT_GRAMMAR);
        Grammar grammar = GrammarLoader.load(path);
        report(grammar, System.out);
    }

    static void report(Grammar grammar, PrintStream out) {
        GreibachNormalizer normalizer = new GreibachNormalizer(NormalizerOptions.defaults().withCaptureSnapshots(true));
        NormalizationResult result = normalizer.normalize(grammar);

        for (Stage stage : Stage.values()) {
            out.println("== " + stage + " ==");
            out.print(result.snapshot(stage));
        }
        for (DanglingReference reference : result.danglingReferences()) {
            out.println("dropped: " + reference);
        }
        out.println("Greibach Normal Form: " + (GreibachValidator.isGreibach(result.grammar()) ? "Pass" : "Fail"));
        GreibachValidator.violations(result.grammar(), true).forEach(violation -> out.println("\t" + violation));
    }
}

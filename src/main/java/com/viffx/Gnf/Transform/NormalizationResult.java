package com.viffx.Gnf.Transform;

import com.viffx.Gnf.Grammar.Grammar;
import com.viffx.Gnf.Symbols.Variable;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link GreibachNormalizer} run.
 *
 * @param grammar            the normalized grammar, the same instance that was passed in
 * @param ordering           the ordering the run used
 * @param helpers            every synthetic variable the run allocated, in allocation order
 * @param danglingReferences productions dropped because their leading variable was undefined
 * @param snapshots          the rendered grammar per stage; empty unless snapshots were requested
 */
public record NormalizationResult(Grammar grammar,
                                  VariableOrdering ordering,
                                  List<Variable> helpers,
                                  List<DanglingReference> danglingReferences,
                                  Map<Stage, String> snapshots) {
    public NormalizationResult {
        helpers = List.copyOf(helpers);
        danglingReferences = List.copyOf(danglingReferences);
        snapshots = Map.copyOf(snapshots);
    }

    /**
     * Returns the rendering captured at {@code stage}, or {@code null} if none was captured.
     */
    public String snapshot(Stage stage) {
        return snapshots.get(stage);
    }

    public boolean droppedProductions() {
        return !danglingReferences.isEmpty();
    }
}

package com.vidnyan.mccabe.domain.complexity;

import com.vidnyan.mccabe.domain.graph.PathGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Scoring pass over sealed graphs. Output keeps the input iteration order.
 */
public final class ComplexityChecker {

    /**
     * Threshold value that disables checking.
     */
    public static final int DISABLED = -1;

    private ComplexityChecker() {
    }

    public static List<GraphScore> score(Collection<PathGraph> graphs) {
        return graphs.stream()
                .map(GraphScore::of)
                .toList();
    }

    /**
     * Graphs scoring strictly above {@code threshold}. A negative threshold yields nothing;
     * zero reports every graph.
     */
    public static List<ComplexityViolation> check(Collection<PathGraph> graphs, int threshold) {
        return violations(score(graphs), threshold);
    }

    public static List<ComplexityViolation> violations(List<GraphScore> scores, int threshold) {
        if (threshold < 0) {
            return List.of();
        }
        List<ComplexityViolation> violations = new ArrayList<>();
        for (GraphScore score : scores) {
            if (score.complexity() > threshold) {
                violations.add(ComplexityViolation.of(score, threshold));
            }
        }
        return violations;
    }
}

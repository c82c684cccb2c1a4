package com.vidnyan.mccabe.domain.complexity;

/**
 * A graph whose complexity exceeds the threshold.
 * Structured only; rendering belongs to the presentation layer.
 */
public record ComplexityViolation(
    String entity,
    int line,
    int column,
    int complexity,
    int threshold,
    String message
) {

    public static ComplexityViolation of(GraphScore score, int threshold) {
        return new ComplexityViolation(
                score.entity(),
                score.line(),
                score.column(),
                score.complexity(),
                threshold,
                score.entity() + " is too complex (" + score.complexity() + ")"
        );
    }
}

package uk.gegc.paperdigest.features.adaptation.domain;

import java.util.List;

/**
 * Result of adapting a text to a reading level.
 *
 * @param text             adapted text, whitespace-collapsed; empty when {@code debug} is set
 * @param complexity       measured complexity of {@code text} in [0, 1]
 * @param targetComplexity threshold configured for {@code level}
 * @param level            requested reading level
 * @param debug            {@code true} when no chunk could be adapted and {@code rawOutputs} is the payload
 * @param rawOutputs       raw model outputs, populated only in debug results
 */
public record AdaptedText(
        String text,
        double complexity,
        double targetComplexity,
        ReadingLevel level,
        boolean debug,
        List<String> rawOutputs
) {

    public AdaptedText {
        rawOutputs = rawOutputs == null ? List.of() : List.copyOf(rawOutputs);
    }

    public static AdaptedText adapted(String text, double complexity, double targetComplexity, ReadingLevel level) {
        return new AdaptedText(text, complexity, targetComplexity, level, false, List.of());
    }

    public static AdaptedText debug(List<String> rawOutputs, double targetComplexity, ReadingLevel level) {
        return new AdaptedText("", 0.0, targetComplexity, level, true, rawOutputs);
    }

    public double divergence() {
        return Math.abs(complexity - targetComplexity);
    }
}

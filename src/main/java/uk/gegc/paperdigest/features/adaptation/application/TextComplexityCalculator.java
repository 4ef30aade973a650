package uk.gegc.paperdigest.features.adaptation.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.shared.config.ReadingLevelConfig;

import java.util.regex.Pattern;

/**
 * Scores text complexity in [0, 1] as the mean of two normalised measures: average sentence length in words
 * and average word length in letters and digits. Each measure is capped at 1 before averaging.
 */
@Component
@RequiredArgsConstructor
public class TextComplexityCalculator {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD_CHARS = Pattern.compile("[^\\p{L}\\p{N}]");

    private final ReadingLevelConfig readingLevelConfig;

    public double calculate(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }

        int sentences = 0;
        int wordsInSentences = 0;
        for (String sentence : SENTENCE_END.split(text)) {
            String trimmed = sentence.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            sentences++;
            wordsInSentences += WHITESPACE.split(trimmed).length;
        }

        int words = 0;
        int letters = 0;
        for (String token : WHITESPACE.split(text.strip())) {
            String word = NON_WORD_CHARS.matcher(token).replaceAll("");
            if (!word.isEmpty()) {
                words++;
                letters += word.length();
            }
        }

        if (sentences == 0 || words == 0) {
            return 0.0;
        }

        double sentenceScore = normalise((double) wordsInSentences / sentences, readingLevelConfig.getSentenceLengthNorm());
        double wordScore = normalise((double) letters / words, readingLevelConfig.getWordLengthNorm());
        return clamp((sentenceScore + wordScore) / 2.0);
    }

    private static double normalise(double value, double norm) {
        return clamp(norm > 0 ? value / norm : 0.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

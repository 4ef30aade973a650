package uk.gegc.paperdigest.shared.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;

/**
 * Complexity targets per reading level and the normalisation used to score adapted text.
 */
@Component
@ConfigurationProperties(prefix = "reading-levels")
@Data
public class ReadingLevelConfig {

    private LevelSettings beginner = new LevelSettings(0.3);
    private LevelSettings intermediate = new LevelSettings(0.6);
    private LevelSettings expert = new LevelSettings(0.9);

    /**
     * Allowed distance between measured complexity and the level threshold before a warning is logged
     */
    private double divergenceTolerance = 0.2;

    /**
     * Average sentence length (words) that maps to a normalised score of 1.0
     */
    private double sentenceLengthNorm = 30.0;

    /**
     * Average word length (characters) that maps to a normalised score of 1.0
     */
    private double wordLengthNorm = 10.0;

    public LevelSettings settingsFor(ReadingLevel level) {
        return switch (level) {
            case BEGINNER -> beginner;
            case INTERMEDIATE -> intermediate;
            case EXPERT -> expert;
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LevelSettings {
        /**
         * Expected complexity score of text adapted for the level
         */
        private double complexityThreshold;
    }
}

package uk.gegc.paperdigest.features.adaptation.application;

import uk.gegc.paperdigest.features.adaptation.domain.AdaptedText;
import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;

import java.util.Map;

public interface LevelAdapterService {

    /**
     * Rewrite {@code text} for the given reading level, one completion per chunk.
     * When no chunk can be adapted the result is a debug result carrying the raw outputs.
     *
     * @param level target level; {@code null} means {@link ReadingLevel#INTERMEDIATE}
     */
    AdaptedText adapt(String text, ReadingLevel level);

    /**
     * Key concepts of {@code text} with a short explanation each, in the order the model listed them.
     * Completion failures propagate.
     */
    Map<String, String> extractKeyConcepts(String text);
}

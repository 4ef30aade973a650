package uk.gegc.paperdigest.features.ai.application;

import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;

/**
 * Builds task prompts from the templates under {@code classpath:prompts/}.
 */
public interface PromptTemplateService {

    /**
     * Two-section summary prompt for a text that fits in one chunk
     */
    String buildSummaryPrompt(String content);

    /**
     * Summary prompt for one chunk of a longer text
     *
     * @param part  1-based chunk position
     * @param total number of chunks
     */
    String buildChunkSummaryPrompt(String content, int part, int total);

    /**
     * Two-section summary prompt over the concatenated chunk summaries
     */
    String buildCombinePrompt(String combinedSummaries);

    String buildAdaptationPrompt(String content, ReadingLevel level);

    String buildFlashcardPrompt(String content, int cardCount);

    String buildKeyConceptsPrompt(String content);

    /**
     * Load a template by its path relative to {@code prompts/}
     */
    String loadPromptTemplate(String templateName);
}

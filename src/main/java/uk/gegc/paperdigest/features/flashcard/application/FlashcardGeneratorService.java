package uk.gegc.paperdigest.features.flashcard.application;

import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;

public interface FlashcardGeneratorService {

    /**
     * Generate up to {@code numCards} distinct question/answer cards from {@code text}.
     *
     * @param numCards number of cards wanted; {@code null} uses the configured default
     * @return the cards, or debug records with the raw completions when none could be parsed
     * @throws IllegalArgumentException if {@code numCards} is less than 1
     * @throws uk.gegc.paperdigest.shared.exception.CompletionAuthException if the credential is rejected
     */
    FlashcardSet generate(String text, Integer numCards);
}

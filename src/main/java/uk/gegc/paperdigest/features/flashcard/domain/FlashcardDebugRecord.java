package uk.gegc.paperdigest.features.flashcard.domain;

public record FlashcardDebugRecord(String rawOutput) {
}

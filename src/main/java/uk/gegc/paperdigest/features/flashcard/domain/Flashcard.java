package uk.gegc.paperdigest.features.flashcard.domain;

public record Flashcard(String question, String answer) {
}

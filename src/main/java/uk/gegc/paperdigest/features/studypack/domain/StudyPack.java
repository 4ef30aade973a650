package uk.gegc.paperdigest.features.studypack.domain;

import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;

public record StudyPack(SummaryResult summary, FlashcardSet flashcards) {
}

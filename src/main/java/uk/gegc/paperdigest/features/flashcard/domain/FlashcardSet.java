package uk.gegc.paperdigest.features.flashcard.domain;

import java.util.List;

/**
 * Outcome of one generation run.
 * <ul>
 *     <li>cards present: normal result</li>
 *     <li>no cards, debug records present: completions came back but none could be parsed</li>
 *     <li>both empty: nothing was requested (blank input) or every request failed</li>
 * </ul>
 */
public record FlashcardSet(
        List<Flashcard> cards,
        List<FlashcardDebugRecord> debugRecords,
        int requested
) {

    public FlashcardSet {
        cards = cards == null ? List.of() : List.copyOf(cards);
        debugRecords = debugRecords == null ? List.of() : List.copyOf(debugRecords);
    }

    public static FlashcardSet of(List<Flashcard> cards, int requested) {
        return new FlashcardSet(cards, List.of(), requested);
    }

    public static FlashcardSet debug(List<FlashcardDebugRecord> debugRecords, int requested) {
        return new FlashcardSet(List.of(), debugRecords, requested);
    }

    public static FlashcardSet empty(int requested) {
        return new FlashcardSet(List.of(), List.of(), requested);
    }

    public boolean isDebug() {
        return cards.isEmpty() && !debugRecords.isEmpty();
    }

    public int size() {
        return cards.size();
    }
}

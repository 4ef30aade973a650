package uk.gegc.paperdigest.features.flashcard.application;

import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.flashcard.domain.Flashcard;

import java.util.List;

/**
 * Plain-text rendering of a card list: {@code Card n:}, {@code Q:} and {@code A:} lines, a blank line after each.
 */
@Component
public class FlashcardFormatter {

    public String format(List<Flashcard> cards) {
        StringBuilder formatted = new StringBuilder();
        int number = 1;
        for (Flashcard card : cards) {
            formatted.append("Card ").append(number++).append(":\n")
                    .append("Q: ").append(card.question()).append('\n')
                    .append("A: ").append(card.answer()).append("\n\n");
        }
        return formatted.toString();
    }
}

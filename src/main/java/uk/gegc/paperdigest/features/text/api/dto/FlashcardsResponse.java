package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardDebugRecord;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;

import java.util.List;

@Schema(name = "FlashcardsResponse", description = "Generated flashcards, or the raw outputs when none could be parsed")
public record FlashcardsResponse(
        List<FlashcardDto> cards,

        @Schema(description = "Cards rendered as 'Card n: / Q: / A:' blocks")
        String formatted,

        @Schema(description = "Number of cards requested", example = "5")
        int requested,

        @Schema(description = "True when completions came back but no card could be parsed")
        boolean debug,

        @Schema(description = "Raw model outputs, only filled for debug results")
        List<String> rawOutputs
) {

    public static FlashcardsResponse from(FlashcardSet set, String formatted) {
        return new FlashcardsResponse(
                set.cards().stream().map(card -> new FlashcardDto(card.question(), card.answer())).toList(),
                formatted,
                set.requested(),
                set.isDebug(),
                set.debugRecords().stream().map(FlashcardDebugRecord::rawOutput).toList()
        );
    }
}

package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "StudyPackResponse", description = "Summary of the text and flashcards generated from that summary")
public record StudyPackResponse(
        SummaryResponse summary,
        FlashcardsResponse flashcards
) {
}

package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FlashcardDto", description = "One question/answer card")
public record FlashcardDto(
        @Schema(description = "Question, at most 150 characters plus ellipsis", example = "What is semantic communication?")
        String question,

        @Schema(description = "Answer, at most 300 characters plus ellipsis")
        String answer
) {
}

package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "FlashcardRequest", description = "Text to turn into flashcards")
public record FlashcardRequest(
        @Schema(description = "Source text")
        @NotBlank(message = "Text cannot be blank")
        @Size(max = 200_000, message = "Text must not exceed 200000 characters")
        String text,

        @Schema(description = "Number of cards wanted, configured default when omitted", example = "5")
        @Min(value = 1, message = "At least one card must be requested")
        @Max(value = 20, message = "At most 20 cards can be requested")
        Integer numCards
) {
}

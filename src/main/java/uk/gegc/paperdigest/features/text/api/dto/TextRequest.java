package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "TextRequest", description = "Research text to process")
public record TextRequest(
        @Schema(description = "Plain text of the paper or excerpt", example = "Semantic communication focuses on the meaning of transmitted information...")
        @NotBlank(message = "Text cannot be blank")
        @Size(max = 200_000, message = "Text must not exceed 200000 characters")
        String text
) {
}

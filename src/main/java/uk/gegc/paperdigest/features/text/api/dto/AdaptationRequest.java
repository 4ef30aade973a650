package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "AdaptationRequest", description = "Text to rewrite for a reading level")
public record AdaptationRequest(
        @Schema(description = "Text to adapt")
        @NotBlank(message = "Text cannot be blank")
        @Size(max = 200_000, message = "Text must not exceed 200000 characters")
        String text,

        @Schema(description = "Target reading level, Intermediate when omitted",
                allowableValues = {"Beginner", "Intermediate", "Expert"}, example = "Beginner")
        @Pattern(regexp = "(?i)beginner|intermediate|expert", message = "Level must be Beginner, Intermediate or Expert")
        String level
) {
}

package uk.gegc.paperdigest.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ArxivPaperRequest", description = "arXiv paper to summarize")
public record ArxivPaperRequest(
        @Schema(description = "arXiv abstract/PDF URL or identifier", example = "https://arxiv.org/abs/2401.01234")
        @NotBlank(message = "URL cannot be blank")
        String url
) {
}

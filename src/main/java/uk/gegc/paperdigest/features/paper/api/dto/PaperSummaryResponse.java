package uk.gegc.paperdigest.features.paper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.paperdigest.features.text.api.dto.SummaryResponse;

@Schema(name = "PaperSummaryResponse", description = "Summary of a retrieved paper")
public record PaperSummaryResponse(
        String identifier,
        String title,
        SummaryResponse summary
) {
}

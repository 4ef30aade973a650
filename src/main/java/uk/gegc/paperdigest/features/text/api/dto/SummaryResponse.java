package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;

import java.util.List;

@Schema(name = "SummaryResponse", description = "Summary paragraph with key highlights")
public record SummaryResponse(
        @Schema(description = "Single summary paragraph")
        String summary,

        @Schema(description = "Up to four highlight bullets")
        List<String> highlights,

        @Schema(description = "Display text: the summary alone, or the Summary / Key Highlights composite")
        String formatted,

        @Schema(description = "True when no usable summary was produced and rawOutputs holds the model output")
        boolean debug,

        @Schema(description = "Raw model outputs, only filled for debug results")
        List<String> rawOutputs
) {

    public static SummaryResponse from(SummaryResult result) {
        return new SummaryResponse(
                result.summary(),
                result.highlights(),
                result.formatted(),
                result.debug(),
                result.debug() ? result.rawOutputs() : List.of()
        );
    }
}

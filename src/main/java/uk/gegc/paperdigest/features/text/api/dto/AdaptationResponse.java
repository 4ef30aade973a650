package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.paperdigest.features.adaptation.domain.AdaptedText;

import java.util.List;

@Schema(name = "AdaptationResponse", description = "Text rewritten for a reading level")
public record AdaptationResponse(
        @Schema(description = "Adapted text")
        String text,

        @Schema(description = "Reading level the text was adapted for", example = "Beginner")
        String level,

        @Schema(description = "Measured complexity in [0, 1]", example = "0.34")
        double complexity,

        @Schema(description = "Complexity threshold of the level", example = "0.3")
        double targetComplexity,

        @Schema(description = "Distance between measured and target complexity", example = "0.04")
        double divergence,

        @Schema(description = "True when no chunk could be adapted and rawOutputs holds the model output")
        boolean debug,

        List<String> rawOutputs
) {

    public static AdaptationResponse from(AdaptedText adapted) {
        return new AdaptationResponse(
                adapted.text(),
                adapted.level().getLabel(),
                adapted.complexity(),
                adapted.targetComplexity(),
                adapted.debug() ? 0.0 : adapted.divergence(),
                adapted.debug(),
                adapted.rawOutputs()
        );
    }
}

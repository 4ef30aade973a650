package uk.gegc.paperdigest.features.text.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "KeyConceptsResponse", description = "Key concepts with a short explanation each, in model order")
public record KeyConceptsResponse(
        Map<String, String> concepts
) {
}

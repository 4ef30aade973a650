package uk.gegc.paperdigest.features.ai.infra.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.adaptation.domain.AdaptationLinePolicy;
import uk.gegc.paperdigest.shared.config.TextProcessingConfig;

import java.util.List;

/**
 * Cleans a level-adaptation completion down to the rewritten text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AdaptedTextResponseParser {

    private final BoilerplateLineFilter lineFilter;
    private final TextProcessingConfig textProcessingConfig;

    /**
     * Applies the configured {@link AdaptationLinePolicy} to the lines left after cleaning. When no line survives,
     * the tag-stripped output is returned as is so the caller still sees what the model produced.
     *
     * @return adapted text; empty only when the model output itself was blank
     */
    public String parse(String rawOutput) {
        String stripped = MarkupStripper.stripTags(rawOutput);
        List<String> lines = lineFilter.cleanLines(stripped);

        if (lines.isEmpty()) {
            log.warn("No line survived cleaning of adapted chunk, returning raw output");
            return stripped.strip();
        }

        AdaptationLinePolicy policy = textProcessingConfig.getAdaptationLinePolicy();
        if (policy == AdaptationLinePolicy.ALL_LINES) {
            return String.join(" ", lines);
        }
        if (lines.size() > 1) {
            log.info("Line policy {} keeps 1 of {} adapted lines", policy, lines.size());
        }
        return lines.get(0);
    }
}

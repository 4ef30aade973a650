package uk.gegc.paperdigest.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.adaptation.domain.AdaptationLinePolicy;

@Component
@ConfigurationProperties(prefix = "text.chunking")
@Data
public class TextProcessingConfig {

    /**
     * Chunk size used by the summarizer, independent of the task's max length
     */
    private int summaryChunkSize = 2000;

    /**
     * Maximum characters kept when a raw model output is written to the log
     */
    private int logPreviewLength = 500;

    /**
     * How many surviving lines of an adapted chunk are kept
     */
    private AdaptationLinePolicy adaptationLinePolicy = AdaptationLinePolicy.FIRST_LINE;
}

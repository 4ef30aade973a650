package uk.gegc.paperdigest.features.ai.infra.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;
import uk.gegc.paperdigest.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts the "Summary:" paragraph and the "Key Highlights:" bullets from a summarizer completion.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SummaryResponseParser {

    private static final String SUMMARY_HEADER = "summary:";
    private static final String HIGHLIGHTS_HEADER = "key highlights:";

    private final BoilerplateLineFilter lineFilter;

    private enum Section {
        BEFORE, SUMMARY, HIGHLIGHTS
    }

    /**
     * Only the first summary section and the first highlights section are honored; a repeated header ends
     * extraction. Highlights stop at the fourth bullet or the first non-bullet line.
     *
     * @throws AIResponseParseException if neither a summary nor a highlight could be found
     */
    public SummaryResult parse(String rawOutput) throws AIResponseParseException {
        List<String> lines = lineFilter.cleanLines(MarkupStripper.stripTags(rawOutput));

        StringBuilder summary = new StringBuilder();
        List<String> highlights = new ArrayList<>();
        Section section = Section.BEFORE;
        boolean seenSummary = false;

        scan:
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.startsWith(SUMMARY_HEADER)) {
                if (seenSummary || section != Section.BEFORE) {
                    log.debug("Repeated summary section ignored");
                    break;
                }
                seenSummary = true;
                section = Section.SUMMARY;
                appendWord(summary, line.substring(SUMMARY_HEADER.length()).strip());
                continue;
            }
            if (lower.startsWith(HIGHLIGHTS_HEADER)) {
                if (section == Section.HIGHLIGHTS) {
                    break;
                }
                section = Section.HIGHLIGHTS;
                continue;
            }

            switch (section) {
                case SUMMARY -> appendWord(summary, line);
                case HIGHLIGHTS -> {
                    if (!isBullet(line)) {
                        break scan;
                    }
                    highlights.add(line);
                    if (highlights.size() >= SummaryResult.MAX_HIGHLIGHTS) {
                        break scan;
                    }
                }
                case BEFORE -> {
                    // preamble before the first header
                }
            }
        }

        if (summary.length() == 0 && highlights.isEmpty()) {
            throw new AIResponseParseException("No 'Summary:' or 'Key Highlights:' section found in completion");
        }
        return SummaryResult.of(summary.toString(), highlights);
    }

    /**
     * Lenient extraction for per-chunk summaries, which are not asked to follow the two-section layout.
     * Falls back to the cleaned lines joined with spaces when no section headers are present.
     *
     * @throws AIResponseParseException if nothing survives cleaning
     */
    public String parsePartial(String rawOutput) throws AIResponseParseException {
        try {
            return parse(rawOutput).formatted();
        } catch (AIResponseParseException e) {
            List<String> lines = lineFilter.cleanLines(MarkupStripper.stripTags(rawOutput));
            if (lines.isEmpty()) {
                throw new AIResponseParseException("Chunk summary is empty after cleaning");
            }
            return String.join(" ", lines);
        }
    }

    static boolean isBullet(String line) {
        return line.startsWith("*") || line.startsWith("-") || line.startsWith("•");
    }

    private static void appendWord(StringBuilder buffer, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (buffer.length() > 0) {
            buffer.append(' ');
        }
        buffer.append(text);
    }
}

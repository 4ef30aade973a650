package uk.gegc.paperdigest.features.summary.domain;

import java.util.List;

/**
 * A summary paragraph with up to four highlight bullets.
 * A debug result carries the raw model outputs instead of a usable summary.
 */
public record SummaryResult(
        String summary,
        List<String> highlights,
        boolean debug,
        List<String> rawOutputs
) {

    public static final int MAX_HIGHLIGHTS = 4;

    public SummaryResult {
        summary = summary == null ? "" : summary;
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        rawOutputs = rawOutputs == null ? List.of() : List.copyOf(rawOutputs);
    }

    public static SummaryResult of(String summary, List<String> highlights) {
        return new SummaryResult(summary, highlights, false, List.of());
    }

    public static SummaryResult empty() {
        return new SummaryResult("", List.of(), false, List.of());
    }

    public static SummaryResult debug(List<String> rawOutputs) {
        return new SummaryResult("", List.of(), true, rawOutputs);
    }

    public boolean hasHighlights() {
        return !highlights.isEmpty();
    }

    public boolean isEmpty() {
        return summary.isBlank() && highlights.isEmpty();
    }

    /**
     * Display form: the summary alone, or the "Summary:" / "Key Highlights:" composite when highlights exist.
     */
    public String formatted() {
        if (debug) {
            return "[DEBUG] Raw model outputs: " + rawOutputs;
        }
        if (highlights.isEmpty()) {
            return summary;
        }
        return "Summary:\n" + summary + "\n\nKey Highlights:\n" + String.join("\n", highlights);
    }
}

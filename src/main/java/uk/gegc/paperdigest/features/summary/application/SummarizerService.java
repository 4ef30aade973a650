package uk.gegc.paperdigest.features.summary.application;

import uk.gegc.paperdigest.features.summary.domain.SummaryResult;

public interface SummarizerService {

    /**
     * Summarise a research text into one paragraph plus up to four highlights.
     * <p>
     * Text that fits in one chunk takes a single completion. Longer text is summarised chunk by chunk and the
     * partial summaries are combined by one more completion.
     *
     * @return the summary; empty for blank input, a debug result when no completion could be used
     * @throws uk.gegc.paperdigest.shared.exception.CompletionAuthException if the credential is rejected
     */
    SummaryResult summarize(String text);
}

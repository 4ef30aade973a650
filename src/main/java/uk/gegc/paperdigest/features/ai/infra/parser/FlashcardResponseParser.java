package uk.gegc.paperdigest.features.ai.infra.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.flashcard.domain.Flashcard;
import uk.gegc.paperdigest.features.flashcard.domain.QaFingerprint;
import uk.gegc.paperdigest.shared.config.FlashcardConfig;
import uk.gegc.paperdigest.shared.util.TextFormatting;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses "Question: ... Answer: ..." blocks out of a flashcard completion.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FlashcardResponseParser {

    static final String QUESTION_MARKER = "Question:";
    static final String ANSWER_MARKER = "Answer:";

    private static final Pattern QUESTION_SPLIT = Pattern.compile(Pattern.quote(QUESTION_MARKER));
    private static final Pattern MARKUP_CHARS = Pattern.compile("[<>*]+");

    private final BoilerplateLineFilter lineFilter;
    private final FlashcardConfig flashcardConfig;

    /**
     * Parse up to {@code limit} new cards. Every accepted card's fingerprint is added to {@code seen}, so one set
     * passed across calls deduplicates a whole generation run.
     *
     * @param rawOutput raw completion
     * @param seen      fingerprints of cards accepted earlier in the run; updated in place
     * @param limit     maximum number of cards to return
     * @return accepted cards, question and answer truncated to the configured lengths
     */
    public List<Flashcard> parse(String rawOutput, Set<QaFingerprint> seen, int limit) {
        List<Flashcard> cards = new ArrayList<>();
        if (rawOutput == null || rawOutput.isBlank() || limit <= 0) {
            return cards;
        }

        String[] segments = QUESTION_SPLIT.split(rawOutput, -1);
        if (segments.length < 2) {
            log.warn("No '{}' marker in flashcard output: {}", QUESTION_MARKER, TextFormatting.preview(rawOutput, 100));
            return cards;
        }

        // segments[0] is whatever preceded the first marker
        for (int i = 1; i < segments.length && cards.size() < limit; i++) {
            String segment = segments[i];
            int answerAt = segment.indexOf(ANSWER_MARKER);
            if (answerAt < 0) {
                log.debug("Flashcard segment {} has no answer, skipped", i);
                continue;
            }

            String question = clean(segment.substring(0, answerAt));
            String answer = clean(segment.substring(answerAt + ANSWER_MARKER.length()));
            if (question.isEmpty() || answer.isEmpty()) {
                log.warn("Empty question or answer after cleaning, card skipped");
                continue;
            }

            if (!seen.add(QaFingerprint.of(question, answer))) {
                log.info("Skipping duplicate flashcard: Q: {}", question);
                continue;
            }

            cards.add(new Flashcard(
                    TextFormatting.formatForDisplay(question, flashcardConfig.getMaxQuestionLength()),
                    TextFormatting.formatForDisplay(answer, flashcardConfig.getMaxAnswerLength())
            ));
        }
        return cards;
    }

    /**
     * Removes markdown emphasis and angle brackets, drops boilerplate lines and joins the rest with spaces.
     */
    String clean(String text) {
        String withoutMarkup = MARKUP_CHARS.matcher(text).replaceAll("");
        return String.join(" ", lineFilter.cleanLines(withoutMarkup)).strip();
    }
}

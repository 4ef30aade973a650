package uk.gegc.paperdigest.features.flashcard.domain;

import java.util.Locale;

/**
 * Case-normalized question/answer pair used to suppress duplicate cards within one generation run.
 */
public record QaFingerprint(String question, String answer) {

    public static QaFingerprint of(String question, String answer) {
        return new QaFingerprint(question.toLowerCase(Locale.ROOT), answer.toLowerCase(Locale.ROOT));
    }
}

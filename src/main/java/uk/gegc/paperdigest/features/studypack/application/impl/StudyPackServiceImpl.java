package uk.gegc.paperdigest.features.studypack.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.features.flashcard.application.FlashcardGeneratorService;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;
import uk.gegc.paperdigest.features.studypack.application.StudyPackService;
import uk.gegc.paperdigest.features.studypack.domain.StudyPack;
import uk.gegc.paperdigest.features.summary.application.SummarizerService;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;
import uk.gegc.paperdigest.shared.config.FlashcardConfig;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;

@Service
@Slf4j
@RequiredArgsConstructor
public class StudyPackServiceImpl implements StudyPackService {

    private final SummarizerService summarizerService;
    private final FlashcardGeneratorService flashcardGeneratorService;
    private final FlashcardConfig flashcardConfig;
    private final ProgressReporter progressReporter;

    @Override
    public StudyPack build(String text) {
        progressReporter.report("Generating summary...", 0.3);
        SummaryResult summary;
        try {
            summary = summarizerService.summarize(text);
        } catch (CompletionAuthException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Study pack summary failed", e);
            summary = SummaryResult.empty();
        }

        progressReporter.report("Generating flashcards...", 0.6);
        FlashcardSet flashcards = FlashcardSet.empty(flashcardConfig.getDefaultNumCards());
        if (summary.debug() || summary.isEmpty()) {
            log.warn("No usable summary, skipping flashcard generation");
        } else {
            try {
                flashcards = flashcardGeneratorService.generate(summary.formatted(), null);
            } catch (CompletionAuthException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Study pack flashcards failed", e);
            }
        }

        progressReporter.report("Formatting results...", 0.9);
        StudyPack pack = new StudyPack(summary, flashcards);
        progressReporter.report("Done!", 1.0);
        return pack;
    }
}

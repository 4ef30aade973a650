package uk.gegc.paperdigest.features.studypack.application;

import uk.gegc.paperdigest.features.studypack.domain.StudyPack;

public interface StudyPackService {

    /**
     * Summarise {@code text}, then generate the default number of flashcards from the summary.
     * Each step that fails leaves its part empty.
     */
    StudyPack build(String text);
}

package uk.gegc.paperdigest.features.paper.application;

import uk.gegc.paperdigest.features.paper.domain.PaperDocument;

/**
 * Retrieves paper text from a remote archive.
 */
public interface PaperSource {

    /**
     * @param reference archive URL or identifier
     * @throws IllegalArgumentException if the reference is not recognised by this source
     * @throws uk.gegc.paperdigest.shared.exception.PaperSourceUnavailableException if the paper cannot be retrieved
     */
    PaperDocument fetch(String reference);
}

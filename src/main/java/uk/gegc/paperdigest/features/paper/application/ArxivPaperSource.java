package uk.gegc.paperdigest.features.paper.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.paper.domain.PaperDocument;
import uk.gegc.paperdigest.shared.exception.PaperSourceUnavailableException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * arXiv source. Recognises abstract and PDF URLs as well as bare identifiers, but retrieval is not implemented.
 */
@Component
@Slf4j
public class ArxivPaperSource implements PaperSource {

    private static final Pattern ARXIV_URL = Pattern.compile(
            "^https?://(?:www\\.)?arxiv\\.org/(?:abs|pdf)/([^?#\\s]+?)(?:\\.pdf)?/?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARXIV_ID = Pattern.compile("^(?:\\d{4}\\.\\d{4,5}|[a-z-]+(?:\\.[A-Z]{2})?/\\d{7})(?:v\\d+)?$");

    @Override
    public PaperDocument fetch(String reference) {
        String identifier = extractIdentifier(reference)
                .orElseThrow(() -> new IllegalArgumentException("Not an arXiv URL or identifier: " + reference));
        log.info("arXiv paper {} requested", identifier);
        throw new PaperSourceUnavailableException("arXiv paper processing is not yet implemented (paper " + identifier + ")");
    }

    /**
     * Identifier from an arXiv URL or a bare identifier, e.g. {@code 2401.01234v2}.
     */
    public Optional<String> extractIdentifier(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        Matcher url = ARXIV_URL.matcher(trimmed);
        String candidate = url.matches() ? url.group(1) : trimmed;
        return ARXIV_ID.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
    }
}

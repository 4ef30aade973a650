package uk.gegc.paperdigest.features.paper.domain;

/**
 * Full text of a retrieved paper.
 */
public record PaperDocument(String identifier, String title, String text) {
}

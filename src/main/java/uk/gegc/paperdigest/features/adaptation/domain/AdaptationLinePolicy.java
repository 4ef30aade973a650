package uk.gegc.paperdigest.features.adaptation.domain;

/**
 * Which lines of a cleaned, adapted chunk survive extraction.
 */
public enum AdaptationLinePolicy {
    /**
     * Keep only the first surviving line. Later paragraphs of a multi-paragraph rewrite are dropped.
     */
    FIRST_LINE,
    /**
     * Keep every surviving line, joined with a single space.
     */
    ALL_LINES
}

package uk.gegc.paperdigest.features.chunking.domain;

/**
 * Contiguous slice of the input text. The index fixes the order in which partial results are aggregated.
 */
public record TextChunk(int index, String content) {

    public int length() {
        return content.length();
    }
}

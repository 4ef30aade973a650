package uk.gegc.paperdigest.features.chunking.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.paperdigest.features.chunking.domain.TextChunk;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TextChunker")
class TextChunkerTest {

    private final TextChunker chunker = new TextChunker();

    @Test
    @DisplayName("chunk: empty or blank input yields zero chunks")
    void chunk_blankInput_returnsNoChunks() {
        assertThat(chunker.chunk("", 100)).isEmpty();
        assertThat(chunker.chunk("   \n\n  ", 100)).isEmpty();
        assertThat(chunker.chunk(null, 100)).isEmpty();
    }

    @Test
    @DisplayName("chunk: short text becomes a single chunk")
    void chunk_shortText_singleChunk() {
        List<TextChunk> chunks = chunker.chunk("Just one paragraph.", 100);

        assertThat(chunks).containsExactly(new TextChunk(0, "Just one paragraph."));
    }

    @Test
    @DisplayName("chunk: paragraphs are packed together while they fit")
    void chunk_packsParagraphsUpToLimit() {
        String a = "a".repeat(40);
        String b = "b".repeat(40);
        String c = "c".repeat(40);

        List<TextChunk> chunks = chunker.chunk(a + "\n\n" + b + "\n\n" + c, 90);

        assertThat(chunks).extracting(TextChunk::content)
                .containsExactly(a + "\n\n" + b, c);
        assertThat(chunks).extracting(TextChunk::index).containsExactly(0, 1);
    }

    @Test
    @DisplayName("chunk: oversized paragraph is split on sentence boundaries")
    void chunk_oversizedParagraph_splitsSentences() {
        String paragraph = "First sentence is here. Second sentence is here. Third sentence is here.";

        List<TextChunk> chunks = chunker.chunk(paragraph, 50);

        assertThat(chunks).extracting(TextChunk::content).containsExactly(
                "First sentence is here. Second sentence is here.",
                "Third sentence is here.");
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(50));
    }

    @Test
    @DisplayName("chunk: a single sentence longer than the limit is emitted alone")
    void chunk_indivisibleSentence_emittedAlone() {
        String longSentence = "x".repeat(80);
        String text = "Short intro.\n\n" + longSentence + ". Tail sentence.";

        List<TextChunk> chunks = chunker.chunk(text, 30);

        assertThat(chunks).extracting(TextChunk::content)
                .containsExactly("Short intro.", longSentence + ".", "Tail sentence.");
    }

    @Test
    @DisplayName("chunk: no chunk exceeds the limit and content is preserved in order")
    void chunk_respectsLimitAndPreservesContent() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            text.append("Paragraph ").append(i).append(" talks about semantic communication. ")
                    .append("It has a second sentence too.\n\n");
        }

        List<TextChunk> chunks = chunker.chunk(text.toString(), 200);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(200));
        String rebuilt = String.join(" ", chunks.stream().map(TextChunk::content).toList()).replaceAll("\\s+", " ");
        assertThat(rebuilt).isEqualTo(text.toString().trim().replaceAll("\\s+", " "));
    }

    @Test
    @DisplayName("chunk: a paragraph that fits joins the sentences left over from a split paragraph")
    void chunk_paragraphAfterSplitSentences_packedTogether() {
        String first = "a".repeat(60) + ".";
        String second = "b".repeat(30) + ".";
        String text = "a".repeat(60) + ". " + "b".repeat(30) + ".\n\nTiny.";

        List<TextChunk> chunks = chunker.chunk(text, 70);

        assertThat(chunks).extracting(TextChunk::content)
                .containsExactly(first, second + "\n\nTiny.");
    }

    @Test
    @DisplayName("chunk: sentences of a split paragraph keep filling the chunk after an earlier paragraph")
    void chunk_sentencesAfterParagraph_packedTogether() {
        String text = "Intro.\n\n" + "c".repeat(40) + ". " + "d".repeat(40) + ".";

        List<TextChunk> chunks = chunker.chunk(text, 60);

        assertThat(chunks).extracting(TextChunk::content)
                .containsExactly("Intro.\n\n" + "c".repeat(40) + ".", "d".repeat(40) + ".");
    }

    @Test
    @DisplayName("chunk: non-positive max length is rejected")
    void chunk_invalidMaxLength_throws() {
        assertThatThrownBy(() -> chunker.chunk("text", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("splitSentences: keeps the period with its sentence")
    void splitSentences_keepsPeriod() {
        assertThat(chunker.splitSentences("One. Two. Three"))
                .containsExactly("One.", "Two.", "Three");
    }
}

package uk.gegc.paperdigest.features.chunking.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.chunking.domain.TextChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into chunks of at most {@code maxLength} characters, keeping paragraphs together where possible.
 * <p>
 * Paragraphs are separated by blank lines. A paragraph longer than the limit is broken on sentence
 * boundaries ({@code ". "}) and the sentences are packed with the same rule, into the same running chunk as the
 * paragraphs around them. A single sentence that is itself longer than the limit becomes a chunk on its own.
 * <p>
 * The result is fully materialised so callers know the chunk count before the first request goes out.
 */
@Component
@Slf4j
public class TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String PARAGRAPH_JOINER = "\n\n";
    private static final String SENTENCE_SEPARATOR = ". ";
    private static final String SENTENCE_JOINER = " ";

    public List<TextChunk> chunk(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Max chunk length must be positive, got " + maxLength);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String rawParagraph : PARAGRAPH_BREAK.split(text)) {
            String paragraph = rawParagraph.strip();
            if (paragraph.isEmpty()) {
                continue;
            }

            if (paragraph.length() <= maxLength) {
                append(chunks, current, paragraph, PARAGRAPH_JOINER, maxLength);
                continue;
            }

            // Oversized paragraph: pack its sentences with the same rule
            String joiner = PARAGRAPH_JOINER;
            for (String sentence : splitSentences(paragraph)) {
                append(chunks, current, sentence, joiner, maxLength);
                joiner = SENTENCE_JOINER;
            }
        }

        if (current.length() > 0) {
            chunks.add(current.toString());
        }

        List<TextChunk> result = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            result.add(new TextChunk(i, chunks.get(i)));
        }
        log.debug("Split {} characters into {} chunks (max {} per chunk)", text.length(), result.size(), maxLength);
        return List.copyOf(result);
    }

    /**
     * Adds {@code unit} to the running chunk when it still fits, otherwise emits the running chunk and starts a
     * new one with {@code unit}.
     */
    private static void append(List<String> chunks, StringBuilder current, String unit, String joiner, int maxLength) {
        if (current.length() > 0 && current.length() + joiner.length() + unit.length() > maxLength) {
            chunks.add(current.toString());
            current.setLength(0);
        }
        if (current.length() > 0) {
            current.append(joiner);
        }
        current.append(unit);
    }

    /**
     * Breaks a paragraph after every {@code ". "} and keeps the terminating period with its sentence.
     */
    List<String> splitSentences(String paragraph) {
        List<String> sentences = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = paragraph.indexOf(SENTENCE_SEPARATOR, start)) >= 0) {
            String sentence = paragraph.substring(start, idx + 1).strip();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
            start = idx + SENTENCE_SEPARATOR.length();
        }
        String tail = paragraph.substring(start).strip();
        if (!tail.isEmpty()) {
            sentences.add(tail);
        }
        return sentences;
    }
}

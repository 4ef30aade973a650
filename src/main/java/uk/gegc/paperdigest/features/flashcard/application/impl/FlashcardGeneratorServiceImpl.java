package uk.gegc.paperdigest.features.flashcard.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.ai.application.CompletionDispatcher;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.features.ai.application.PromptTemplateService;
import uk.gegc.paperdigest.features.ai.domain.model.CompletionRequest;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.features.ai.infra.parser.FlashcardResponseParser;
import uk.gegc.paperdigest.features.chunking.application.TextChunker;
import uk.gegc.paperdigest.features.chunking.domain.TextChunk;
import uk.gegc.paperdigest.features.flashcard.application.FlashcardGeneratorService;
import uk.gegc.paperdigest.features.flashcard.domain.Flashcard;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardDebugRecord;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;
import uk.gegc.paperdigest.features.flashcard.domain.QaFingerprint;
import uk.gegc.paperdigest.shared.config.CompletionApiConfig;
import uk.gegc.paperdigest.shared.config.FlashcardConfig;
import uk.gegc.paperdigest.shared.config.TextProcessingConfig;
import uk.gegc.paperdigest.shared.exception.AiServiceException;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.util.TextFormatting;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class FlashcardGeneratorServiceImpl implements FlashcardGeneratorService {

    private final CompletionDispatcher completionDispatcher;
    private final PromptTemplateService promptTemplateService;
    private final FlashcardResponseParser flashcardResponseParser;
    private final TextChunker textChunker;
    private final CompletionApiConfig completionApiConfig;
    private final FlashcardConfig flashcardConfig;
    private final TextProcessingConfig textProcessingConfig;
    private final ProgressReporter progressReporter;

    @Override
    public FlashcardSet generate(String text, Integer numCards) {
        int target = numCards != null ? numCards : flashcardConfig.getDefaultNumCards();
        if (target < 1) {
            throw new IllegalArgumentException("Number of cards must be at least 1, got " + target);
        }
        if (text == null || text.isBlank()) {
            log.info("[FlashcardGen] Empty input, no cards requested");
            return FlashcardSet.empty(target);
        }

        int maxLength = completionApiConfig.settingsFor(TaskType.FLASHCARD_GEN).getMaxLength();
        List<TextChunk> chunks = textChunker.chunk(text, maxLength);
        int total = chunks.size();
        int perRequest = Math.max(1, flashcardConfig.getMaxCardsPerRequest());

        List<Flashcard> cards = new ArrayList<>();
        Set<QaFingerprint> seen = new HashSet<>();
        List<String> rawOutputs = new ArrayList<>();

        for (TextChunk chunk : chunks) {
            int remaining = target - cards.size();
            if (remaining <= 0) {
                break;
            }
            int requested = Math.min(remaining, perRequest);
            progressReporter.report(
                    String.format("Generating flashcards from part %d of %d...", chunk.index() + 1, total),
                    (double) cards.size() / target);
            log.info("[FlashcardGen] Requesting {} cards for chunk {}/{}", requested, chunk.index() + 1, total);

            String prompt = promptTemplateService.buildFlashcardPrompt(chunk.content(), requested);
            String raw = dispatchSkippingFailures(new CompletionRequest(TaskType.FLASHCARD_GEN, prompt, chunk.index(), total));
            if (raw == null) {
                continue;
            }
            rawOutputs.add(raw);
            cards.addAll(parse(raw, seen, remaining));
        }

        if (cards.isEmpty()) {
            log.warn("No flashcards generated from chunks, trying with the whole text as fallback.");
            String prompt = promptTemplateService.buildFlashcardPrompt(text.strip(), target);
            String raw = dispatchSkippingFailures(CompletionRequest.single(TaskType.FLASHCARD_GEN, prompt));
            if (raw != null) {
                rawOutputs.add(raw);
                cards.addAll(parse(raw, seen, target));
            }
        }

        if (cards.isEmpty()) {
            if (rawOutputs.isEmpty()) {
                log.error("[FlashcardGen] Every completion request failed, no cards generated");
                return FlashcardSet.empty(target);
            }
            log.error("[FlashcardGen] No parseable cards in {} completions, returning raw outputs", rawOutputs.size());
            return FlashcardSet.debug(rawOutputs.stream().map(FlashcardDebugRecord::new).toList(), target);
        }

        log.info("[FlashcardGen] Generated {} of {} requested cards", cards.size(), target);
        return FlashcardSet.of(cards, target);
    }

    private String dispatchSkippingFailures(CompletionRequest request) {
        try {
            return completionDispatcher.dispatch(request);
        } catch (CompletionAuthException e) {
            throw e;
        } catch (AiServiceException e) {
            log.warn("[FlashcardGen] Completion failed for {}: {}", request.describe(), e.getMessage());
            return null;
        }
    }

    private List<Flashcard> parse(String raw, Set<QaFingerprint> seen, int limit) {
        if (raw.isBlank()) {
            log.warn("[FlashcardGen] Model returned empty string, skipping");
            return List.of();
        }
        log.info("[FlashcardGen] Raw model output: {}",
                TextFormatting.preview(raw, textProcessingConfig.getLogPreviewLength()));
        try {
            return flashcardResponseParser.parse(raw, seen, limit);
        } catch (RuntimeException e) {
            log.warn("[FlashcardGen] Error parsing flashcards: {} | Raw: {}", e.getMessage(), TextFormatting.preview(raw, 200));
            return List.of();
        }
    }
}

package uk.gegc.paperdigest.features.adaptation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.adaptation.application.LevelAdapterService;
import uk.gegc.paperdigest.features.adaptation.application.TextComplexityCalculator;
import uk.gegc.paperdigest.features.adaptation.domain.AdaptedText;
import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;
import uk.gegc.paperdigest.features.ai.application.CompletionDispatcher;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.features.ai.application.PromptTemplateService;
import uk.gegc.paperdigest.features.ai.domain.model.CompletionRequest;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.features.ai.infra.parser.AdaptedTextResponseParser;
import uk.gegc.paperdigest.features.ai.infra.parser.KeyConceptParser;
import uk.gegc.paperdigest.features.chunking.application.TextChunker;
import uk.gegc.paperdigest.features.chunking.domain.TextChunk;
import uk.gegc.paperdigest.shared.config.CompletionApiConfig;
import uk.gegc.paperdigest.shared.config.ReadingLevelConfig;
import uk.gegc.paperdigest.shared.config.TextProcessingConfig;
import uk.gegc.paperdigest.shared.exception.AiServiceException;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.util.TextFormatting;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class LevelAdapterServiceImpl implements LevelAdapterService {

    private final CompletionDispatcher completionDispatcher;
    private final PromptTemplateService promptTemplateService;
    private final AdaptedTextResponseParser adaptedTextResponseParser;
    private final KeyConceptParser keyConceptParser;
    private final TextChunker textChunker;
    private final TextComplexityCalculator complexityCalculator;
    private final CompletionApiConfig completionApiConfig;
    private final ReadingLevelConfig readingLevelConfig;
    private final TextProcessingConfig textProcessingConfig;
    private final ProgressReporter progressReporter;

    @Override
    public AdaptedText adapt(String text, ReadingLevel level) {
        ReadingLevel target = level != null ? level : ReadingLevel.INTERMEDIATE;
        double targetComplexity = readingLevelConfig.settingsFor(target).getComplexityThreshold();

        int maxLength = completionApiConfig.settingsFor(TaskType.LEVEL_ADAPTER).getMaxLength();
        List<TextChunk> chunks = textChunker.chunk(text, maxLength);
        if (chunks.isEmpty()) {
            log.info("[LevelAdapter] Empty input, nothing to adapt");
            return AdaptedText.adapted("", 0.0, targetComplexity, target);
        }

        int total = chunks.size();
        List<String> adaptedChunks = new ArrayList<>();
        List<String> rawOutputs = new ArrayList<>();

        for (TextChunk chunk : chunks) {
            progressReporter.report(
                    String.format("Adapting part %d of %d for %s readers...", chunk.index() + 1, total, target.getLabel()),
                    (double) chunk.index() / total);
            String prompt = promptTemplateService.buildAdaptationPrompt(chunk.content(), target);

            String raw;
            try {
                raw = completionDispatcher.dispatch(
                        new CompletionRequest(TaskType.LEVEL_ADAPTER, prompt, chunk.index(), total));
            } catch (CompletionAuthException e) {
                throw e;
            } catch (AiServiceException e) {
                log.warn("[LevelAdapter] Skipping chunk {}/{}: {}", chunk.index() + 1, total, e.getMessage());
                continue;
            }

            rawOutputs.add(raw);
            if (raw == null || raw.isBlank()) {
                log.warn("[LevelAdapter] Model returned empty string for chunk {}/{}. Chunk: {}",
                        chunk.index() + 1, total, TextFormatting.preview(chunk.content(), 100));
                continue;
            }
            log.info("[LevelAdapter] Raw model output: {}", preview(raw));

            String cleaned = adaptedTextResponseParser.parse(raw);
            if (cleaned.isEmpty()) {
                log.warn("[LevelAdapter] Adapted chunk {}/{} is empty after post-processing", chunk.index() + 1, total);
                continue;
            }
            log.info("[LevelAdapter] Cleaned output: {}", preview(cleaned));
            adaptedChunks.add(cleaned);
        }

        if (adaptedChunks.isEmpty()) {
            log.error("[LevelAdapter] All adapted chunks were empty. Returning raw outputs for debugging.");
            return AdaptedText.debug(rawOutputs, targetComplexity, target);
        }

        String finalText = TextFormatting.collapseWhitespace(String.join(" ", adaptedChunks));
        double complexity = complexityCalculator.calculate(finalText);
        AdaptedText result = AdaptedText.adapted(finalText, complexity, targetComplexity, target);

        if (result.divergence() > readingLevelConfig.getDivergenceTolerance()) {
            log.warn("Adapted text complexity ({}) is not close to target ({}) for level '{}'. Returning best attempt.",
                    String.format("%.2f", complexity), String.format("%.2f", targetComplexity), target.getLabel());
        }
        return result;
    }

    @Override
    public Map<String, String> extractKeyConcepts(String text) {
        String prompt = promptTemplateService.buildKeyConceptsPrompt(text);
        try {
            String raw = completionDispatcher.dispatch(CompletionRequest.single(TaskType.LEVEL_ADAPTER, prompt));
            Map<String, String> concepts = keyConceptParser.parse(raw);
            log.info("[LevelAdapter] Extracted {} key concepts", concepts.size());
            return concepts;
        } catch (AiServiceException e) {
            log.error("Error extracting key concepts: {}", e.getMessage());
            throw e;
        }
    }

    private String preview(String text) {
        return TextFormatting.preview(text, textProcessingConfig.getLogPreviewLength());
    }
}

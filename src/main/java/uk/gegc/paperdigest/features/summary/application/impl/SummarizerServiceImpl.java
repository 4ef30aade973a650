package uk.gegc.paperdigest.features.summary.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.ai.application.CompletionDispatcher;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.features.ai.application.PromptTemplateService;
import uk.gegc.paperdigest.features.ai.domain.model.CompletionRequest;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.features.ai.infra.parser.SummaryResponseParser;
import uk.gegc.paperdigest.features.chunking.application.TextChunker;
import uk.gegc.paperdigest.features.chunking.domain.TextChunk;
import uk.gegc.paperdigest.features.summary.application.SummarizerService;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;
import uk.gegc.paperdigest.shared.config.TextProcessingConfig;
import uk.gegc.paperdigest.shared.exception.AIResponseParseException;
import uk.gegc.paperdigest.shared.exception.AiServiceException;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.util.TextFormatting;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SummarizerServiceImpl implements SummarizerService {

    private final CompletionDispatcher completionDispatcher;
    private final PromptTemplateService promptTemplateService;
    private final SummaryResponseParser summaryResponseParser;
    private final TextChunker textChunker;
    private final TextProcessingConfig textProcessingConfig;
    private final ProgressReporter progressReporter;

    @Override
    public SummaryResult summarize(String text) {
        List<TextChunk> chunks = textChunker.chunk(text, textProcessingConfig.getSummaryChunkSize());
        if (chunks.isEmpty()) {
            log.info("[Summarizer] Empty input, nothing to summarize");
            return SummaryResult.empty();
        }

        if (chunks.size() == 1) {
            String prompt = promptTemplateService.buildSummaryPrompt(chunks.get(0).content());
            log.info("[Summarizer] Prompt sent to model: {} (length: {})", preview(prompt), prompt.length());
            return summarizeOnce(CompletionRequest.single(TaskType.SUMMARIZER, prompt), new ArrayList<>());
        }

        int total = chunks.size();
        List<String> rawOutputs = new ArrayList<>();
        List<String> partials = new ArrayList<>();
        for (TextChunk chunk : chunks) {
            progressReporter.report(
                    String.format("Summarizing part %d of %d...", chunk.index() + 1, total),
                    (double) chunk.index() / total);
            String prompt = promptTemplateService.buildChunkSummaryPrompt(chunk.content(), chunk.index() + 1, total);
            log.info("[Summarizer] Chunk {}/{} prompt sent to model: {} (length: {})",
                    chunk.index() + 1, total, preview(prompt), prompt.length());
            try {
                String raw = completionDispatcher.dispatch(
                        new CompletionRequest(TaskType.SUMMARIZER, prompt, chunk.index(), total));
                rawOutputs.add(raw);
                partials.add(summaryResponseParser.parsePartial(raw));
            } catch (CompletionAuthException e) {
                throw e;
            } catch (AiServiceException | AIResponseParseException e) {
                log.warn("[Summarizer] Skipping chunk {}/{}: {}", chunk.index() + 1, total, e.getMessage());
            }
        }

        if (partials.isEmpty()) {
            log.error("[Summarizer] No chunk produced a usable summary, returning raw outputs");
            return SummaryResult.debug(rawOutputs);
        }

        String combined = String.join("\n", partials);
        String finalPrompt = promptTemplateService.buildCombinePrompt(combined);
        log.info("[Summarizer] Final combining prompt sent to model: {} (length: {})",
                preview(finalPrompt), finalPrompt.length());
        SummaryResult result = summarizeOnce(CompletionRequest.single(TaskType.SUMMARIZER, finalPrompt), rawOutputs);
        if (result.debug()) {
            log.warn("[Summarizer] Combining pass failed, falling back to {} partial summaries", partials.size());
            return SummaryResult.of(TextFormatting.collapseWhitespace(combined), List.of());
        }
        return result;
    }

    private SummaryResult summarizeOnce(CompletionRequest request, List<String> rawOutputs) {
        String raw;
        try {
            raw = completionDispatcher.dispatch(request);
        } catch (CompletionAuthException e) {
            throw e;
        } catch (AiServiceException e) {
            log.error("[Summarizer] Completion failed for {}: {}", request.describe(), e.getMessage());
            return SummaryResult.debug(rawOutputs);
        }

        rawOutputs.add(raw);
        log.info("[Summarizer] Raw model output: {}", preview(raw));
        try {
            return summaryResponseParser.parse(raw);
        } catch (AIResponseParseException e) {
            log.error("[Summarizer] Could not extract summary: {}", e.getMessage());
            return SummaryResult.debug(rawOutputs);
        }
    }

    private String preview(String text) {
        return TextFormatting.preview(text, textProcessingConfig.getLogPreviewLength());
    }
}

package uk.gegc.paperdigest.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;
import uk.gegc.paperdigest.features.ai.application.PromptTemplateService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    private static final String COMBINED_SOURCE_NOTE = " (which is a set of summaries of a research paper)";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildSummaryPrompt(String content) {
        requireContent(content);
        return loadPromptTemplate("summary/sections.txt")
                .replace("{source}", "")
                .replace("{content}", content);
    }

    @Override
    public String buildChunkSummaryPrompt(String content, int part, int total) {
        requireContent(content);
        if (part < 1 || part > total) {
            throw new IllegalArgumentException("Chunk part must be within 1.." + total + ", got " + part);
        }
        return loadPromptTemplate("summary/chunk.txt")
                .replace("{part}", String.valueOf(part))
                .replace("{total}", String.valueOf(total))
                .replace("{content}", content);
    }

    @Override
    public String buildCombinePrompt(String combinedSummaries) {
        requireContent(combinedSummaries);
        return loadPromptTemplate("summary/sections.txt")
                .replace("{source}", COMBINED_SOURCE_NOTE)
                .replace("{content}", combinedSummaries);
    }

    @Override
    public String buildAdaptationPrompt(String content, ReadingLevel level) {
        requireContent(content);
        ReadingLevel target = level != null ? level : ReadingLevel.INTERMEDIATE;
        return loadPromptTemplate(getAdaptationTemplateName(target))
                .replace("{content}", content);
    }

    @Override
    public String buildFlashcardPrompt(String content, int cardCount) {
        requireContent(content);
        if (cardCount < 1) {
            throw new IllegalArgumentException("Card count must be positive");
        }
        return loadPromptTemplate("flashcards/cards.txt")
                .replace("{count}", String.valueOf(cardCount))
                .replace("{content}", content);
    }

    @Override
    public String buildKeyConceptsPrompt(String content) {
        requireContent(content);
        return loadPromptTemplate("concepts/key-concepts.txt")
                .replace("{content}", content);
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new IllegalStateException("Failed to load template: " + templateName, e);
        }
    }

    private static void requireContent(String content) {
        if (content == null) {
            throw new IllegalArgumentException("Prompt content cannot be null");
        }
        if (content.trim().isEmpty()) {
            throw new IllegalArgumentException("Prompt content cannot be empty");
        }
    }

    private String getAdaptationTemplateName(ReadingLevel level) {
        return switch (level) {
            case BEGINNER -> "adaptation/beginner.txt";
            case INTERMEDIATE -> "adaptation/intermediate.txt";
            case EXPERT -> "adaptation/expert.txt";
        };
    }
}

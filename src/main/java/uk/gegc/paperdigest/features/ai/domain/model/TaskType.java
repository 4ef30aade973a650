package uk.gegc.paperdigest.features.ai.domain.model;

public enum TaskType {
    SUMMARIZER("summarizer"),
    LEVEL_ADAPTER("level_adapter"),
    FLASHCARD_GEN("flashcard_gen");

    private final String key;

    TaskType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

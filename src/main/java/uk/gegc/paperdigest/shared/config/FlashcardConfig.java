package uk.gegc.paperdigest.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flashcards")
@Data
public class FlashcardConfig {

    private int defaultNumCards = 5;

    /**
     * Upper bound on the cards requested by a single completion call
     */
    private int maxCardsPerRequest = 3;

    private int maxQuestionLength = 150;

    private int maxAnswerLength = 300;
}

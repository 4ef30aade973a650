package uk.gegc.paperdigest.features.text.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.paperdigest.features.adaptation.application.LevelAdapterService;
import uk.gegc.paperdigest.features.adaptation.domain.AdaptedText;
import uk.gegc.paperdigest.features.adaptation.domain.ReadingLevel;
import uk.gegc.paperdigest.features.flashcard.application.FlashcardFormatter;
import uk.gegc.paperdigest.features.flashcard.application.FlashcardGeneratorService;
import uk.gegc.paperdigest.features.flashcard.domain.FlashcardSet;
import uk.gegc.paperdigest.features.studypack.application.StudyPackService;
import uk.gegc.paperdigest.features.studypack.domain.StudyPack;
import uk.gegc.paperdigest.features.summary.application.SummarizerService;
import uk.gegc.paperdigest.features.text.api.dto.AdaptationRequest;
import uk.gegc.paperdigest.features.text.api.dto.AdaptationResponse;
import uk.gegc.paperdigest.features.text.api.dto.FlashcardRequest;
import uk.gegc.paperdigest.features.text.api.dto.FlashcardsResponse;
import uk.gegc.paperdigest.features.text.api.dto.KeyConceptsResponse;
import uk.gegc.paperdigest.features.text.api.dto.StudyPackResponse;
import uk.gegc.paperdigest.features.text.api.dto.SummaryResponse;
import uk.gegc.paperdigest.features.text.api.dto.TextRequest;

/**
 * Text processing endpoints: summary, reading-level adaptation, flashcards, key concepts and the
 * summary-then-flashcards study pack.
 */
@RestController
@RequestMapping("/api/v1/text")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Text Processing", description = "Summaries, reading-level adaptation and flashcards for research text")
@ApiResponses({
        @ApiResponse(responseCode = "400", description = "Invalid request",
                content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
        @ApiResponse(responseCode = "429", description = "Completion service rate limit hit; see Retry-After",
                content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
        @ApiResponse(responseCode = "502", description = "Completion service rejected the credential or request",
                content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
})
public class TextPipelineController {

    private final SummarizerService summarizerService;
    private final LevelAdapterService levelAdapterService;
    private final FlashcardGeneratorService flashcardGeneratorService;
    private final FlashcardFormatter flashcardFormatter;
    private final StudyPackService studyPackService;

    @Operation(
            summary = "Summarize text",
            description = "Produces one summary paragraph and up to four key highlights. Long text is summarized " +
                    "chunk by chunk and the partial summaries are combined."
    )
    @ApiResponse(responseCode = "200", description = "Summary generated",
            content = @Content(schema = @Schema(implementation = SummaryResponse.class)))
    @PostMapping("/summary")
    public ResponseEntity<SummaryResponse> summarize(@Valid @RequestBody TextRequest request) {
        log.info("Summary requested for {} characters", request.text().length());
        return ResponseEntity.ok(SummaryResponse.from(summarizerService.summarize(request.text())));
    }

    @Operation(
            summary = "Adapt text to a reading level",
            description = "Rewrites the text for Beginner, Intermediate or Expert readers and reports its measured complexity"
    )
    @ApiResponse(responseCode = "200", description = "Text adapted",
            content = @Content(schema = @Schema(implementation = AdaptationResponse.class)))
    @PostMapping("/adaptation")
    public ResponseEntity<AdaptationResponse> adapt(@Valid @RequestBody AdaptationRequest request) {
        ReadingLevel level = ReadingLevel.fromLabel(request.level());
        log.info("Adaptation to {} requested for {} characters", level, request.text().length());
        AdaptedText adapted = levelAdapterService.adapt(request.text(), level);
        return ResponseEntity.ok(AdaptationResponse.from(adapted));
    }

    @Operation(
            summary = "Generate flashcards",
            description = "Generates distinct question/answer cards. When none can be parsed the raw model output is returned with debug=true."
    )
    @ApiResponse(responseCode = "200", description = "Flashcards generated",
            content = @Content(schema = @Schema(implementation = FlashcardsResponse.class)))
    @PostMapping("/flashcards")
    public ResponseEntity<FlashcardsResponse> flashcards(@Valid @RequestBody FlashcardRequest request) {
        FlashcardSet set = flashcardGeneratorService.generate(request.text(), request.numCards());
        return ResponseEntity.ok(FlashcardsResponse.from(set, flashcardFormatter.format(set.cards())));
    }

    @Operation(summary = "Extract key concepts", description = "Lists the key concepts of the text with a brief explanation each")
    @ApiResponse(responseCode = "200", description = "Concepts extracted",
            content = @Content(schema = @Schema(implementation = KeyConceptsResponse.class)))
    @PostMapping("/key-concepts")
    public ResponseEntity<KeyConceptsResponse> keyConcepts(@Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(new KeyConceptsResponse(levelAdapterService.extractKeyConcepts(request.text())));
    }

    @Operation(
            summary = "Build a study pack",
            description = "Summarizes the text, then generates flashcards from the summary. A failed step leaves its part empty."
    )
    @ApiResponse(responseCode = "200", description = "Study pack generated",
            content = @Content(schema = @Schema(implementation = StudyPackResponse.class)))
    @PostMapping("/study-pack")
    public ResponseEntity<StudyPackResponse> studyPack(@Valid @RequestBody TextRequest request) {
        StudyPack pack = studyPackService.build(request.text());
        return ResponseEntity.ok(new StudyPackResponse(
                SummaryResponse.from(pack.summary()),
                FlashcardsResponse.from(pack.flashcards(), flashcardFormatter.format(pack.flashcards().cards()))
        ));
    }
}

package uk.gegc.paperdigest.features.paper.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.paperdigest.features.paper.api.dto.ArxivPaperRequest;
import uk.gegc.paperdigest.features.paper.api.dto.PaperSummaryResponse;
import uk.gegc.paperdigest.features.paper.application.PaperSource;
import uk.gegc.paperdigest.features.paper.domain.PaperDocument;
import uk.gegc.paperdigest.features.summary.application.SummarizerService;
import uk.gegc.paperdigest.features.text.api.dto.SummaryResponse;

@RestController
@RequestMapping("/api/v1/papers")
@RequiredArgsConstructor
@Tag(name = "Papers", description = "Summaries of papers fetched from remote archives")
public class PaperController {

    private final PaperSource paperSource;
    private final SummarizerService summarizerService;

    @Operation(summary = "Summarize an arXiv paper", description = "Not yet available: always answers 501")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Paper summarized",
                    content = @Content(schema = @Schema(implementation = PaperSummaryResponse.class))),
            @ApiResponse(responseCode = "400", description = "Not an arXiv URL or identifier",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "501", description = "arXiv retrieval is not implemented",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/arxiv")
    public ResponseEntity<PaperSummaryResponse> summarizeArxiv(@Valid @RequestBody ArxivPaperRequest request) {
        PaperDocument paper = paperSource.fetch(request.url());
        return ResponseEntity.ok(new PaperSummaryResponse(
                paper.identifier(),
                paper.title(),
                SummaryResponse.from(summarizerService.summarize(paper.text()))
        ));
    }
}

package uk.gegc.paperdigest.features.ai.infra.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.paperdigest.features.summary.domain.SummaryResult;
import uk.gegc.paperdigest.shared.config.BoilerplateFilterConfig;
import uk.gegc.paperdigest.shared.exception.AIResponseParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SummaryResponseParser Tests")
class SummaryResponseParserTest {

    private final SummaryResponseParser parser =
            new SummaryResponseParser(new BoilerplateLineFilter(new BoilerplateFilterConfig()));

    @Test
    @DisplayName("parse: summary paragraph and highlight bullets are extracted")
    void parse_fullLayout() {
        String raw = """
                Here is a possible summary of the paper.
                Summary:
                The paper introduces a new attention mechanism.
                It reduces training cost.

                Key Highlights:
                * Attention only
                - Faster training
                • Better BLEU
                """;

        SummaryResult result = parser.parse(raw);

        assertThat(result.summary())
                .isEqualTo("The paper introduces a new attention mechanism. It reduces training cost.");
        assertThat(result.highlights()).containsExactly("* Attention only", "- Faster training", "• Better BLEU");
        assertThat(result.debug()).isFalse();
    }

    @Test
    @DisplayName("parse: text on the header line belongs to the summary")
    void parse_sameLineSummary() {
        SummaryResult result = parser.parse("Summary: Inline summary text.\ncontinued here");

        assertThat(result.summary()).isEqualTo("Inline summary text. continued here");
        assertThat(result.hasHighlights()).isFalse();
        assertThat(result.formatted()).isEqualTo("Inline summary text. continued here");
    }

    @Test
    @DisplayName("parse: only the first of two summary sections is kept")
    void parse_repeatedSummary_firstOnly() {
        String raw = """
                Summary:
                First version.
                Key Highlights:
                * one
                Summary:
                Second version.
                Key Highlights:
                * two
                """;

        SummaryResult result = parser.parse(raw);

        assertThat(result.summary()).isEqualTo("First version.");
        assertThat(result.highlights()).containsExactly("* one");
    }

    @Test
    @DisplayName("parse: highlights are capped at four")
    void parse_highlightCap() {
        String raw = """
                Summary:
                Text.
                Key Highlights:
                * a
                * b
                * c
                * d
                * e
                """;

        assertThat(parser.parse(raw).highlights()).hasSize(SummaryResult.MAX_HIGHLIGHTS).containsExactly("* a", "* b", "* c", "* d");
    }

    @Test
    @DisplayName("parse: highlights stop at the first non-bullet line")
    void parse_highlightsStopAtProse() {
        String raw = """
                Summary:
                Text.
                Key Highlights:
                * a
                That concludes the summary.
                * b
                """;

        assertThat(parser.parse(raw).highlights()).containsExactly("* a");
    }

    @Test
    @DisplayName("parse: markup tags are removed before extraction")
    void parse_stripsTags() {
        SummaryResult result = parser.parse("<s>Summary: <b>Bold</b> claim.</s>");

        assertThat(result.summary()).isEqualTo("Bold claim.");
    }

    @Test
    @DisplayName("parse: output without any section throws")
    void parse_noSections_throws() {
        assertThatThrownBy(() -> parser.parse("I apologize, but I cannot help.\nJust prose."))
                .isInstanceOf(AIResponseParseException.class);
    }

    @Test
    @DisplayName("parsePartial: falls back to cleaned lines when there is no header")
    void parsePartial_noHeader_joinsLines() {
        String raw = "Here is a possible summary\nThe chunk covers datasets.\n\nIt uses WMT 2014.";

        assertThat(parser.parsePartial(raw)).isEqualTo("The chunk covers datasets. It uses WMT 2014.");
    }

    @Test
    @DisplayName("parsePartial: structured output keeps its formatted layout")
    void parsePartial_structured() {
        String raw = "Summary:\nPart text.\nKey Highlights:\n* point";

        assertThat(parser.parsePartial(raw)).isEqualTo("Summary:\nPart text.\n\nKey Highlights:\n* point");
    }

    @Test
    @DisplayName("parsePartial: only boilerplate throws")
    void parsePartial_onlyBoilerplate_throws() {
        assertThatThrownBy(() -> parser.parsePartial("I apologize\n---\n"))
                .isInstanceOf(AIResponseParseException.class);
    }

    @Test
    @DisplayName("isBullet: recognises star, dash and bullet characters")
    void isBullet() {
        assertThat(SummaryResponseParser.isBullet("* x")).isTrue();
        assertThat(SummaryResponseParser.isBullet("- x")).isTrue();
        assertThat(SummaryResponseParser.isBullet("• x")).isTrue();
        assertThat(SummaryResponseParser.isBullet("1. x")).isFalse();
    }
}

package uk.gegc.paperdigest.features.paper.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.paperdigest.shared.exception.PaperSourceUnavailableException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArxivPaperSource Tests")
class ArxivPaperSourceTest {

    private final ArxivPaperSource source = new ArxivPaperSource();

    @ParameterizedTest
    @CsvSource({
            "https://arxiv.org/abs/1706.03762, 1706.03762",
            "http://www.arxiv.org/pdf/2401.01234v2.pdf, 2401.01234v2",
            "https://arxiv.org/abs/hep-th/9901001, hep-th/9901001",
            "2310.06825, 2310.06825"
    })
    @DisplayName("extractIdentifier: recognises URLs and bare identifiers")
    void extractIdentifier_recognised(String reference, String expected) {
        assertThat(source.extractIdentifier(reference)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"https://example.com/abs/1706.03762", "not a paper", "  "})
    @DisplayName("extractIdentifier: rejects anything else")
    void extractIdentifier_rejected(String reference) {
        assertThat(source.extractIdentifier(reference)).isEmpty();
    }

    @Test
    @DisplayName("fetch: a recognised paper is reported as unavailable")
    void fetch_unavailable() {
        assertThatThrownBy(() -> source.fetch("https://arxiv.org/abs/1706.03762"))
                .isInstanceOf(PaperSourceUnavailableException.class)
                .hasMessage("arXiv paper processing is not yet implemented (paper 1706.03762)");
    }

    @Test
    @DisplayName("fetch: an unrecognised reference is an invalid argument")
    void fetch_invalid() {
        assertThatThrownBy(() -> source.fetch("https://example.com"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package uk.gegc.paperdigest.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.shared.config.BoilerplateFilterConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered line-filter policy shared by every extractor.
 * <p>
 * Built-in rules drop blank lines, apology and meta-comment lines the model tends to emit around its answer,
 * code fences and separator lines. Patterns from {@code extraction.boilerplate.extra-patterns} are appended
 * after the built-ins.
 */
@Component
@Slf4j
public class BoilerplateLineFilter {

    static final List<String> META_COMMENT_PREFIXES = List.of(
            "the summary should",
            "no, start with",
            "here is a possible",
            "please provide",
            "i apologize",
            "this is not",
            "waiting for your text",
            "now create",
            "only output",
            "summarize the following",
            "do not include",
            "output the summary",
            "output only",
            "in summary:",
            "rewritten response is:",
            "rest of the original text remains the same"
    );

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final List<LineFilterRule> rules;

    public BoilerplateLineFilter(BoilerplateFilterConfig filterConfig) {
        List<LineFilterRule> built = new ArrayList<>();
        built.add(new LineFilterRule("blank", String::isEmpty));
        built.add(prefixRule("meta-comment", META_COMMENT_PREFIXES.stream().map(Pattern::quote).toList()));
        built.add(new LineFilterRule("code-fence", line -> line.startsWith("```")));
        built.add(new LineFilterRule("separator", line -> line.startsWith("---")));

        List<String> extras = filterConfig.getExtraPatterns();
        for (int i = 0; i < extras.size(); i++) {
            built.add(prefixRule("custom-" + (i + 1), List.of(extras.get(i))));
        }
        this.rules = List.copyOf(built);
        log.debug("Boilerplate filter initialised with {} rules", rules.size());
    }

    private static LineFilterRule prefixRule(String name, List<String> alternatives) {
        Pattern pattern = Pattern.compile("^(?:" + String.join("|", alternatives) + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new LineFilterRule(name, line -> pattern.matcher(line).lookingAt());
    }

    public List<LineFilterRule> rules() {
        return rules;
    }

    /**
     * First rule matching the trimmed line, if any.
     */
    public Optional<LineFilterRule> matchingRule(String line) {
        String trimmed = line.strip();
        for (LineFilterRule rule : rules) {
            if (rule.matches(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean isBoilerplate(String line) {
        return matchingRule(line).isPresent();
    }

    /**
     * Splits {@code text} into trimmed lines and keeps those no rule discards, in order.
     */
    public List<String> cleanLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> kept = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            String trimmed = line.strip();
            if (!isBoilerplate(trimmed)) {
                kept.add(trimmed);
            }
        }
        return kept;
    }
}

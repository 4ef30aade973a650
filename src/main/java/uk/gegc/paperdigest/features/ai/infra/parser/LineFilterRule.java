package uk.gegc.paperdigest.features.ai.infra.parser;

import java.util.function.Predicate;

/**
 * A named predicate over a trimmed output line. A line matching any rule is discarded.
 */
public record LineFilterRule(String name, Predicate<String> matcher) {

    public boolean matches(String trimmedLine) {
        return matcher.test(trimmedLine);
    }
}

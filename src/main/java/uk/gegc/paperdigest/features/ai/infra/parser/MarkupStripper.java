package uk.gegc.paperdigest.features.ai.infra.parser;

import java.util.regex.Pattern;

final class MarkupStripper {

    // non-greedy and single-line, so "<" ... ">" spanning lines is left alone
    private static final Pattern TAG = Pattern.compile("<.*?>");

    private MarkupStripper() {
    }

    static String stripTags(String raw) {
        return raw == null ? "" : TAG.matcher(raw).replaceAll("");
    }
}

package uk.gegc.paperdigest.shared.util;

/**
 * Display helpers for model output.
 */
public final class TextFormatting {

    public static final String ELLIPSIS = "...";

    private TextFormatting() {
    }

    /**
     * Collapses every whitespace run (newlines included) to a single space and trims the ends.
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return String.join(" ", text.trim().split("\\s+"));
    }

    /**
     * Collapses whitespace and, when {@code maxLength} is positive and exceeded, cuts the text to
     * {@code maxLength} characters followed by {@value #ELLIPSIS}.
     */
    public static String formatForDisplay(String text, int maxLength) {
        String collapsed = collapseWhitespace(text);
        if (maxLength > 0 && collapsed.length() > maxLength) {
            return collapsed.substring(0, maxLength) + ELLIPSIS;
        }
        return collapsed;
    }

    public static String formatForDisplay(String text) {
        return formatForDisplay(text, 0);
    }

    /**
     * Head of {@code text} for log lines.
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
    }
}

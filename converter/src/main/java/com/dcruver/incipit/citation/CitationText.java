package com.dcruver.incipit.citation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the citation matchers.
 */
public final class CitationText {

    // ". " before an uppercase letter or an opening quote
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("\\.\\s+(?=[A-Z\"'“])");

    private CitationText() {
    }

    /**
     * Split at the first sentence boundary.
     *
     * @return one element if there is no boundary, otherwise the text before and after it
     */
    public static String[] splitFirstSentence(String text) {
        Matcher matcher = SENTENCE_SPLIT.matcher(text);
        if (!matcher.find()) {
            return new String[] {text};
        }
        return new String[] {text.substring(0, matcher.start()), text.substring(matcher.end())};
    }

    /**
     * Turn "Last, First" into "First Last". Text without a comma is returned trimmed.
     */
    public static String reorderName(String name) {
        int comma = name.indexOf(',');
        if (comma < 0) {
            return name.strip();
        }
        String last = name.substring(0, comma).strip();
        String first = name.substring(comma + 1).strip();
        return first + " " + last;
    }

    /**
     * Strip the given characters from both ends of the text.
     */
    public static String strip(String text, String characters) {
        int start = 0;
        int end = text.length();
        while (start < end && characters.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && characters.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Strip trailing characters only.
     */
    public static String stripTrailing(String text, String characters) {
        int end = text.length();
        while (end > 0 && characters.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end);
    }

    public static String emptyToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}

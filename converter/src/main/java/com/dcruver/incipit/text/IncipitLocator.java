package com.dcruver.incipit.text;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the opening words of the sentence in which a note reference sits.
 *
 * A sentence boundary is ".", "?" or "!" followed by whitespace and an uppercase
 * letter. Titles such as "Dr." and the "v." of case names never end a sentence.
 */
@Component
public class IncipitLocator {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile(
        "(?<!\\bDr\\.)(?<!\\bMr\\.)(?<!\\bMs\\.)(?<!\\bMrs\\.)(?<!\\bProf\\.)"
            + "(?<!\\bRev\\.)(?<!\\bSen\\.)(?<!\\bRep\\.)(?<!\\bv\\.)"
            + "(?<=[.?!])\\s+(?=[A-Z])");

    private static final Pattern LEADING_QUOTES = Pattern.compile("^[\"'“‘\\s]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?\"'”’]+$");

    /**
     * Return up to {@code wordCount} leading words of the sentence containing {@code offset}.
     *
     * @param paragraphText full text of the paragraph
     * @param offset character offset of the reference within the paragraph
     * @param wordCount number of words to capture, must be positive
     * @return the incipit, or an empty string if nothing precedes the offset
     */
    public String locate(String paragraphText, int offset, int wordCount) {
        if (wordCount <= 0) {
            throw new IllegalArgumentException("Word count must be positive: " + wordCount);
        }
        if (paragraphText == null || offset <= 0) {
            return "";
        }

        String textBefore = paragraphText.substring(0, Math.min(offset, paragraphText.length()));
        if (textBefore.isEmpty()) {
            return "";
        }

        // Last sentence is everything after the final boundary
        int sentenceStart = 0;
        Matcher boundary = SENTENCE_BOUNDARY.matcher(textBefore);
        while (boundary.find()) {
            sentenceStart = boundary.end();
        }

        String sentence = textBefore.substring(sentenceStart).strip();
        sentence = LEADING_QUOTES.matcher(sentence).replaceFirst("");
        if (sentence.isBlank()) {
            return "";
        }

        String[] words = sentence.split("\\s+");
        String[] selected = Arrays.copyOf(words, Math.min(wordCount, words.length));
        int last = selected.length - 1;
        selected[last] = TRAILING_PUNCTUATION.matcher(selected[last]).replaceFirst("");

        return String.join(" ", selected).strip();
    }
}

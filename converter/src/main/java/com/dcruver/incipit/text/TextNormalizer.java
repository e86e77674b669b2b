package com.dcruver.incipit.text;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Cleans citation text before parsing.
 * Removes "p."/"pp." page prefixes and turns numeric hyphen ranges into en dash ranges.
 */
@Component
public class TextNormalizer {

    public static final char EN_DASH = '–';

    private static final Pattern PAGE_PREFIX = Pattern.compile("(?<=[\\s(,])p{1,2}\\.\\s*(?=\\d)");
    private static final Pattern HYPHEN_RANGE = Pattern.compile("(\\d)-(\\d)");

    /**
     * Normalize citation text. Never fails; null becomes an empty string.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }

        String cleaned = PAGE_PREFIX.matcher(text).replaceAll("");
        cleaned = HYPHEN_RANGE.matcher(cleaned).replaceAll("$1" + EN_DASH + "$2");
        return cleaned.strip();
    }
}

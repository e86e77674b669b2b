package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationText;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Books identified by their "City: Publisher, Year" block, optionally in parentheses.
 */
public class BookMatcher implements CitationMatcher {

    // A capitalised place-name word, or a place abbreviation such as "St."
    private static final String CITY_WORD = "(?:(?:St|Ste|Ft|Mt|Pt)\\.|[A-Z][A-Za-z'\\-]*)";

    private static final Pattern PUBLICATION = Pattern.compile(
        "\\(?((?<![\\w.])" + CITY_WORD + "(?:\\s+" + CITY_WORD + ")*:\\s*[^,():]+,\\s*\\d{4})\\)?");

    // "Last, First", "Last, First M." or "Last, Jr., First"
    private static final Pattern LEADING_AUTHOR = Pattern.compile(
        "^([A-Z][\\w\\-']+)(?:,\\s+(Jr\\.|Sr\\.|III))?,\\s+([A-Z][\\w\\-'.]+(?:\\s+[A-Z]\\.)?)");

    // A spelled-out given name that swallowed the sentence period, e.g. "Sigmund."
    private static final Pattern GIVEN_NAME_WITH_PERIOD = Pattern.compile(".*\\b[A-Z][a-z]+\\.$");

    @Override
    public String getName() {
        return "book";
    }

    @Override
    public MatchOutcome match(String text) {
        Matcher publication = PUBLICATION.matcher(text);
        if (!publication.find()) {
            return MatchOutcome.noMatch();
        }

        String prePublication = CitationText.stripTrailing(text.substring(0, publication.start()).strip(), ".,");

        String author = null;
        String title;

        Matcher leadingAuthor = LEADING_AUTHOR.matcher(prePublication);
        if (leadingAuthor.find()) {
            String suffix = leadingAuthor.group(2);
            String given = leadingAuthor.group(3).strip();
            if (GIVEN_NAME_WITH_PERIOD.matcher(given).matches()) {
                given = given.substring(0, given.length() - 1);
            }
            author = given + " " + leadingAuthor.group(1)
                + (suffix != null ? " " + suffix : "");
            title = CitationText.strip(prePublication.substring(leadingAuthor.end()), "., ");
        } else {
            String[] parts = CitationText.splitFirstSentence(prePublication);
            if (parts.length > 1) {
                author = parts[0].strip();
                title = parts[1].strip();
            } else {
                title = prePublication;
            }
        }

        return MatchOutcome.matched(CitationRecord.builder()
            .raw(text)
            .type(CitationType.BOOK)
            .author(CitationText.emptyToNull(author))
            .title(CitationText.emptyToNull(title))
            .publication(publication.group(1))
            .build());
    }
}

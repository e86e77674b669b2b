package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationText;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

import java.util.List;

/**
 * Depositions and testimony, e.g. "Klerman Deposition, Oct 15, 1985".
 * The witness segment doubles as author and title.
 */
public class TranscriptMatcher implements CitationMatcher {

    private static final List<String> KEYWORDS = List.of("Deposition", "Testimony", "Transcript");

    @Override
    public String getName() {
        return "transcript";
    }

    @Override
    public MatchOutcome match(String text) {
        if (KEYWORDS.stream().noneMatch(text::contains)) {
            return MatchOutcome.noMatch();
        }

        int comma = text.indexOf(',');
        String head = (comma >= 0 ? text.substring(0, comma) : text).strip();
        String rest = comma >= 0 ? text.substring(comma + 1).strip() : null;

        return MatchOutcome.matched(CitationRecord.builder()
            .raw(text)
            .type(CitationType.TRANSCRIPT)
            .author(CitationText.emptyToNull(head))
            .title(CitationText.emptyToNull(head))
            .publication(CitationText.emptyToNull(rest))
            .build());
    }
}

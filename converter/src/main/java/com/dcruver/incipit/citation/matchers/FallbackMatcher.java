package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationText;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

/**
 * Last resort. "Last, First. Title" becomes a journal citation, anything else
 * a generic citation whose title is the whole text.
 */
public class FallbackMatcher implements CitationMatcher {

    @Override
    public String getName() {
        return "fallback";
    }

    @Override
    public MatchOutcome match(String text) {
        String[] parts = CitationText.splitFirstSentence(text);

        if (parts.length > 1 && parts[0].contains(",")) {
            return MatchOutcome.matched(CitationRecord.builder()
                .raw(text)
                .type(CitationType.JOURNAL)
                .author(CitationText.emptyToNull(CitationText.reorderName(parts[0])))
                .title(CitationText.emptyToNull(parts[1].strip()))
                .build());
        }

        return MatchOutcome.matched(CitationRecord.builder()
            .raw(text)
            .type(CitationType.GENERIC)
            .title(CitationText.emptyToNull(text))
            .build());
    }
}

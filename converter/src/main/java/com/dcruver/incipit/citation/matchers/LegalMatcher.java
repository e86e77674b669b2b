package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

import java.util.regex.Pattern;

/**
 * Case law. The whole citation is the title.
 */
public class LegalMatcher implements CitationMatcher {

    private static final Pattern VERSUS = Pattern.compile("\\s+v\\.\\s+");

    @Override
    public String getName() {
        return "legal";
    }

    @Override
    public MatchOutcome match(String text) {
        if (!VERSUS.matcher(text).find()) {
            return MatchOutcome.noMatch();
        }
        return MatchOutcome.matched(CitationRecord.builder()
            .raw(text)
            .type(CitationType.LEGAL)
            .title(text)
            .build());
    }
}

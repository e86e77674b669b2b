package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Archive citations: boxes and folders, papers, collections, personal archives
 * and arbitration recordings.
 */
public class ArchivalMatcher implements CitationMatcher {

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("(.+?)\\s*,\\s*(Box|Folder|Tape|Reel|Carton)\\s+(\\d+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(.+?)\\s+Arbitration\\s+(Videos?|Tapes?|Transcripts?)(?:,\\s*(.+))?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(.+?)\\s+Papers\\s*,\\s*(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(.+?)\\s+Archives?\\s*,\\s*(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(.+?)\\s+Collection\\s*,\\s*(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(.+?)\\s+Personal\\s+Archive(?:,\\s*(.+))?", Pattern.CASE_INSENSITIVE)
    );

    private static final String ARBITRATION = "Arbitration";

    @Override
    public String getName() {
        return "archival";
    }

    @Override
    public MatchOutcome match(String text) {
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.lookingAt()) {
                continue;
            }

            String matched = matcher.group(0);
            CitationRecord.CitationRecordBuilder record = CitationRecord.builder()
                .raw(text)
                .type(CitationType.ARCHIVAL);

            if (text.contains(ARBITRATION)) {
                // "Osheroff Arbitration Videos, Tape 3" is cited by the recording set
                int comma = matched.indexOf(',');
                record.title(comma >= 0 ? matched.substring(0, comma) : matched)
                    .details(text);
            } else {
                record.title(matcher.group(1).strip())
                    .details(matched);
            }
            return MatchOutcome.matched(record.build());
        }
        return MatchOutcome.noMatch();
    }
}

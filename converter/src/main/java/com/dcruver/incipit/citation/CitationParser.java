package com.dcruver.incipit.citation;

import com.dcruver.incipit.citation.matchers.ArchivalMatcher;
import com.dcruver.incipit.citation.matchers.BookMatcher;
import com.dcruver.incipit.citation.matchers.FallbackMatcher;
import com.dcruver.incipit.citation.matchers.LegalMatcher;
import com.dcruver.incipit.citation.matchers.MedicalJournalMatcher;
import com.dcruver.incipit.citation.matchers.TranscriptMatcher;
import com.dcruver.incipit.config.IncipitProperties;
import com.dcruver.incipit.text.TextNormalizer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposes free-text citations into {@link CitationRecord}s.
 *
 * Matchers are tried in a fixed priority order and the first match wins:
 * archival, transcript, legal, medical, book, then the journal/generic fallback.
 * A matcher that throws is logged and treated as not matching.
 */
@Component
@Slf4j
public class CitationParser {

    private static final Pattern TRAILING_PAGE = Pattern.compile("[,.]\\s*(\\d+[-–]?\\d*)\\.?$");

    private final TextNormalizer normalizer;
    private final List<CitationMatcher> matchers;

    @Autowired
    public CitationParser(TextNormalizer normalizer, IncipitProperties properties) {
        this(normalizer, List.of(
            new ArchivalMatcher(),
            new TranscriptMatcher(),
            new LegalMatcher(),
            new MedicalJournalMatcher(properties.getMedicalJournals()),
            new BookMatcher(),
            new FallbackMatcher()
        ));
    }

    public CitationParser(TextNormalizer normalizer, List<CitationMatcher> matchers) {
        this.normalizer = normalizer;
        this.matchers = List.copyOf(matchers);
    }

    /**
     * Parse citation text into a typed record.
     */
    public CitationRecord parse(String text) {
        return parseWithTrace(text).getRecord();
    }

    /**
     * Parse and keep the outcome of every matcher that was tried.
     */
    public ParseResult parseWithTrace(String text) {
        String working = normalizer.normalize(text);

        String page = null;
        Matcher pageMatcher = TRAILING_PAGE.matcher(working);
        if (pageMatcher.find()) {
            page = pageMatcher.group(1);
            working = CitationText.stripTrailing(working.substring(0, pageMatcher.start()).strip(), ".,");
        }

        List<CascadeStep> steps = new ArrayList<>();
        for (CitationMatcher matcher : matchers) {
            MatchOutcome outcome = tryMatcher(matcher, working);
            steps.add(new CascadeStep(matcher.getName(), outcome));

            if (outcome.isMatched()) {
                CitationRecord record = outcome.getRecord().toBuilder()
                    .raw(text)
                    .page(page)
                    .build();
                log.debug("Parsed citation as {} via {} matcher", record.getType(), matcher.getName());
                return new ParseResult(record, steps);
            }
        }

        // Only reachable with a custom matcher list lacking a catch-all
        CitationRecord unparsed = CitationRecord.builder()
            .raw(text)
            .type(CitationType.GENERIC)
            .page(page)
            .build();
        return new ParseResult(unparsed, steps);
    }

    private MatchOutcome tryMatcher(CitationMatcher matcher, String text) {
        try {
            MatchOutcome outcome = matcher.match(text);
            return outcome != null ? outcome : MatchOutcome.noMatch();
        } catch (RuntimeException e) {
            log.warn("Citation matcher '{}' failed on \"{}\": {}", matcher.getName(), text, e.getMessage());
            return MatchOutcome.faulted(e);
        }
    }

    /**
     * Outcome of one matcher during a parse.
     */
    @Value
    public static class CascadeStep {
        String matcherName;
        MatchOutcome outcome;
    }

    /**
     * Parsed record plus the cascade steps that produced it.
     */
    @Value
    public static class ParseResult {
        CitationRecord record;
        List<CascadeStep> steps;
    }
}

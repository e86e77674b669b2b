package com.dcruver.incipit.citation;

/**
 * One step of the citation parsing cascade.
 * Implementations return {@link MatchOutcome#noMatch()} when their pattern does not apply.
 */
public interface CitationMatcher {

    /**
     * Name used in logs and decision traces
     */
    String getName();

    /**
     * Try to decompose citation text that has already been normalized
     * and stripped of its trailing page reference.
     */
    MatchOutcome match(String text);
}

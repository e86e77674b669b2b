package com.dcruver.incipit.citation;

import com.dcruver.incipit.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link CitationHistoryEngine} for every document conversion.
 */
@Component
@RequiredArgsConstructor
public class CitationHistoryEngineFactory {

    private final CitationParser parser;
    private final FingerprintGenerator fingerprints;
    private final TextNormalizer normalizer;

    public CitationHistoryEngine newEngine() {
        return new CitationHistoryEngine(parser, fingerprints, normalizer);
    }
}

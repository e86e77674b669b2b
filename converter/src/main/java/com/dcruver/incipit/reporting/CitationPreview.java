package com.dcruver.incipit.reporting;

import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.Emission;
import lombok.Builder;
import lombok.Data;

/**
 * How one endnote would be rewritten.
 */
@Data
@Builder
public class CitationPreview {
    private final String id;
    private final String raw;
    private final String processed;
    private final CitationType type;
    private final String fingerprint;
    private final Emission emission;
}

package com.dcruver.incipit.citation;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the history engine for one note.
 */
@Value
@Builder
public class FormattedCitation {
    String text;
    Emission emission;

    // Null for pass-through notes
    CitationRecord record;
}

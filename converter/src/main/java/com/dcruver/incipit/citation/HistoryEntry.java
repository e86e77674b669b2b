package com.dcruver.incipit.citation;

import lombok.Value;

/**
 * A processed citation in document order.
 */
@Value
public class HistoryEntry {
    CitationRecord record;
    String fingerprint;
    Emission emission;
}

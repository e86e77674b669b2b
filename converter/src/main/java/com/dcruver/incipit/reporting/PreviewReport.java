package com.dcruver.incipit.reporting;

import com.dcruver.incipit.citation.Emission;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Dry-run result for a whole document.
 */
@Data
@Builder
public class PreviewReport {
    private final String documentName;
    private final Instant generatedAt;
    private final List<CitationPreview> changes;

    public long count(Emission emission) {
        return changes.stream()
            .filter(change -> change.getEmission() == emission)
            .count();
    }
}

package com.dcruver.incipit.citation;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Structured fields of one parsed citation.
 * Optional fields are null when the parser could not find them.
 */
@Value
@Builder(toBuilder = true)
@With
public class CitationRecord {
    String raw;
    CitationType type;

    String author;
    String title;
    String publication;
    String page;

    // Full matched text of archival citations
    String details;

    String fingerprint;

    public boolean hasAuthor() {
        return author != null && !author.isBlank();
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasPage() {
        return page != null && !page.isBlank();
    }

    /**
     * Records with neither author nor title are passed through untouched.
     */
    public boolean isIdentifiable() {
        return hasAuthor() || hasTitle();
    }
}

package com.dcruver.incipit.domain;

import com.dcruver.incipit.citation.Emission;
import lombok.Builder;
import lombok.Value;

/**
 * One rendered entry of the consolidated notes section.
 */
@Value
@Builder
public class NoteBlock {
    String noteId;
    String bookmarkName;
    String incipit;
    EmphasisStyle emphasis;
    String citation;
    String rawText;

    // Null when citation styling is off
    Emission emission;

    // True when formatting failed and the raw text was used
    boolean fallback;

    public boolean hasIncipit() {
        return incipit != null && !incipit.isEmpty();
    }
}

package com.dcruver.incipit.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The consolidated notes section, ordered by note number.
 */
@Value
@Builder
public class NotesSection {
    String heading;
    String headingStyle;
    boolean pageBreakBefore;
    List<NoteBlock> notes;
}

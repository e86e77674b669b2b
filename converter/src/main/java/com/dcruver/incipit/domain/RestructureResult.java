package com.dcruver.incipit.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the packaging layer needs to rewrite the document.
 */
@Value
@Builder
public class RestructureResult {
    List<EditInstruction> edits;
    List<ReferenceAnchor> anchors;
    NotesSection notesSection;
    int notesProcessed;
}

package com.dcruver.incipit.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A structural change to the body, addressed by paragraph and inline index
 * in the document as it was read.
 */
@Value
@Builder
public class EditInstruction {
    EditType type;
    int paragraphIndex;
    int inlineIndex;
    String noteId;
    String bookmarkId;
    String bookmarkName;

    public enum EditType {
        /**
         * Bracket the reference position with a bookmark start/end pair
         */
        INSERT_BOOKMARK,

        /**
         * Drop the inline reference mark and its visible text
         */
        REMOVE_REFERENCE_MARKER
    }
}

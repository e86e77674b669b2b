package com.dcruver.incipit.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Where a note reference sits in the body.
 * {@code offset} counts the paragraph's run text up to and including the reference run.
 */
@Value
@Builder
public class ReferenceSite {
    int paragraphIndex;
    int inlineIndex;
    String paragraphText;
    String noteId;
    int offset;
}

package com.dcruver.incipit.domain;

import lombok.Value;

/**
 * Bookmark generated for one reference site.
 */
@Value
public class ReferenceAnchor {
    String noteId;
    int offset;
    String bookmarkId;
    String bookmarkName;
}

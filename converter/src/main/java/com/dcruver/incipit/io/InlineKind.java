package com.dcruver.incipit.io;

/**
 * Kinds of inline content inside a paragraph.
 */
public enum InlineKind {
    TEXT,

    /**
     * Reference mark in the body pointing at an endnote
     */
    NOTE_REFERENCE,

    /**
     * The endnote's own number mark at the start of the note text
     */
    NOTE_MARKER,

    BOOKMARK_START,
    BOOKMARK_END,

    /**
     * Field such as {@code PAGEREF}; {@code text} holds the cached result
     */
    FIELD,

    /**
     * Page break
     */
    BREAK
}

package com.dcruver.incipit.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One run of inline content. Which fields are set depends on {@link #kind}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class Inline {
    private InlineKind kind;
    private String text;

    private String noteId;          // NOTE_REFERENCE
    private String bookmarkId;      // BOOKMARK_START, BOOKMARK_END
    private String bookmarkName;    // BOOKMARK_START
    private String instruction;     // FIELD

    private boolean bold;
    private boolean italic;

    public static Inline text(String text) {
        return Inline.builder().kind(InlineKind.TEXT).text(text).build();
    }

    public static Inline noteReference(String noteId) {
        return Inline.builder().kind(InlineKind.NOTE_REFERENCE).noteId(noteId).build();
    }

    public static Inline noteMarker() {
        return Inline.builder().kind(InlineKind.NOTE_MARKER).build();
    }

    public static Inline bookmarkStart(String bookmarkId, String bookmarkName) {
        return Inline.builder().kind(InlineKind.BOOKMARK_START).bookmarkId(bookmarkId).bookmarkName(bookmarkName).build();
    }

    public static Inline bookmarkEnd(String bookmarkId) {
        return Inline.builder().kind(InlineKind.BOOKMARK_END).bookmarkId(bookmarkId).build();
    }

    public static Inline field(String instruction, String cachedResult) {
        return Inline.builder().kind(InlineKind.FIELD).instruction(instruction).text(cachedResult).build();
    }

    public static Inline pageBreak() {
        return Inline.builder().kind(InlineKind.BREAK).build();
    }

    /**
     * Text this inline contributes to the paragraph's visible run text.
     * Reference marks contribute their visible marker text, if any.
     */
    public String visibleText() {
        if (text == null) {
            return "";
        }
        return kind == InlineKind.TEXT || kind == InlineKind.NOTE_REFERENCE ? text : "";
    }
}

package com.dcruver.incipit.domain;

import com.dcruver.incipit.domain.EditInstruction.EditType;
import com.dcruver.incipit.io.DocumentModel;
import com.dcruver.incipit.io.Inline;
import com.dcruver.incipit.io.InlineKind;
import com.dcruver.incipit.io.Paragraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Applies a {@link RestructureResult} to a document model in place.
 */
@Component
@Slf4j
public class DocumentEditApplier {

    private static final String FIELD_PLACEHOLDER = "0";
    private static final String NUMBER_SEPARATOR = ". ";
    private static final String INCIPIT_SEPARATOR = ": ";

    public DocumentModel apply(DocumentModel document, RestructureResult result) {
        if (document.getParagraphs() == null) {
            throw new DocumentStructureException("Document has no body paragraphs");
        }

        List<Paragraph> paragraphs = new ArrayList<>(document.getParagraphs());
        applyEdits(paragraphs, result.getEdits());
        appendNotesSection(paragraphs, result.getNotesSection());

        document.setParagraphs(paragraphs);
        return document;
    }

    private void applyEdits(List<Paragraph> paragraphs, List<EditInstruction> edits) {
        // paragraph -> inline index (descending) -> edits at that position
        Map<Integer, TreeMap<Integer, List<EditInstruction>>> byPosition = new TreeMap<>();
        for (EditInstruction edit : edits) {
            byPosition
                .computeIfAbsent(edit.getParagraphIndex(), p -> new TreeMap<>(Comparator.reverseOrder()))
                .computeIfAbsent(edit.getInlineIndex(), i -> new ArrayList<>())
                .add(edit);
        }

        for (Map.Entry<Integer, TreeMap<Integer, List<EditInstruction>>> entry : byPosition.entrySet()) {
            int paragraphIndex = entry.getKey();
            if (paragraphIndex < 0 || paragraphIndex >= paragraphs.size()) {
                throw new DocumentStructureException("Edit refers to missing paragraph " + paragraphIndex);
            }

            Paragraph paragraph = paragraphs.get(paragraphIndex);
            List<Inline> inlines = new ArrayList<>(paragraph.getInlines());

            // Right to left so earlier indices stay valid
            for (Map.Entry<Integer, List<EditInstruction>> position : entry.getValue().entrySet()) {
                applyAt(inlines, paragraphIndex, position.getKey(), position.getValue());
            }

            // The caller's paragraphs stay as read until every edit has succeeded
            paragraphs.set(paragraphIndex, Paragraph.builder()
                .style(paragraph.getStyle())
                .inlines(inlines)
                .build());
        }
    }

    private void applyAt(List<Inline> inlines, int paragraphIndex, int inlineIndex, List<EditInstruction> edits) {
        if (inlineIndex < 0 || inlineIndex >= inlines.size()) {
            throw new DocumentStructureException(String.format(
                "Edit refers to missing inline %d in paragraph %d", inlineIndex, paragraphIndex));
        }

        EditInstruction bookmark = null;
        boolean removeMarker = false;
        for (EditInstruction edit : edits) {
            Inline target = inlines.get(inlineIndex);
            if (target.getKind() != InlineKind.NOTE_REFERENCE || !Objects.equals(target.getNoteId(), edit.getNoteId())) {
                throw new DocumentStructureException(String.format(
                    "Expected reference to note %s at paragraph %d, inline %d but found %s",
                    edit.getNoteId(), paragraphIndex, inlineIndex, target.getKind()));
            }
            if (edit.getType() == EditType.INSERT_BOOKMARK) {
                if (bookmark != null) {
                    throw new DocumentStructureException(String.format(
                        "Two bookmarks planned for paragraph %d, inline %d", paragraphIndex, inlineIndex));
                }
                bookmark = edit;
            } else {
                removeMarker = true;
            }
        }

        if (removeMarker) {
            inlines.remove(inlineIndex);
        }
        if (bookmark != null) {
            int endIndex = removeMarker ? inlineIndex + 1 : inlineIndex + 2;
            inlines.add(inlineIndex, Inline.bookmarkStart(bookmark.getBookmarkId(), bookmark.getBookmarkName()));
            inlines.add(endIndex, Inline.bookmarkEnd(bookmark.getBookmarkId()));
        }
    }

    private void appendNotesSection(List<Paragraph> paragraphs, NotesSection section) {
        if (section.isPageBreakBefore()) {
            paragraphs.add(Paragraph.of(Inline.pageBreak()));
        }

        Paragraph heading = Paragraph.of(Inline.text(section.getHeading()));
        heading.setStyle(section.getHeadingStyle());
        paragraphs.add(heading);

        for (NoteBlock note : section.getNotes()) {
            paragraphs.add(renderNote(note));
        }
        log.debug("Appended notes section with {} notes", section.getNotes().size());
    }

    private Paragraph renderNote(NoteBlock note) {
        List<Inline> inlines = new ArrayList<>();
        inlines.add(Inline.field(" PAGEREF " + note.getBookmarkName() + " \\h ", FIELD_PLACEHOLDER));
        inlines.add(Inline.text(NUMBER_SEPARATOR));

        if (note.hasIncipit()) {
            Inline incipit = Inline.text(note.getIncipit());
            if (note.getEmphasis() == EmphasisStyle.BOLD) {
                incipit.setBold(true);
            } else {
                incipit.setItalic(true);
            }
            inlines.add(incipit);
            inlines.add(Inline.text(INCIPIT_SEPARATOR));
        }

        inlines.add(Inline.text(note.getCitation()));
        return Paragraph.builder().inlines(inlines).build();
    }
}

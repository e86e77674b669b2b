package com.dcruver.incipit.domain;

import com.dcruver.incipit.citation.CitationHistoryEngine;
import com.dcruver.incipit.citation.CitationHistoryEngineFactory;
import com.dcruver.incipit.citation.FormattedCitation;
import com.dcruver.incipit.config.IncipitProperties;
import com.dcruver.incipit.domain.EditInstruction.EditType;
import com.dcruver.incipit.text.IncipitLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans the rewrite of a document: a bookmark in place of every note reference
 * and one consolidated notes section, each note labelled with its incipit and
 * its citation restyled.
 *
 * Notes are processed in ascending numeric id order with a fresh citation
 * history per call. A note that fails to format keeps its raw text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentRestructurer {

    private final IncipitLocator incipitLocator;
    private final CitationHistoryEngineFactory engineFactory;
    private final IncipitProperties properties;

    /**
     * Plan the rewrite.
     *
     * @param sites reference sites in body order
     * @param rawNotes raw note text by note id
     * @param options conversion options
     * @param appendToExistingBody whether the section follows existing content and needs a page break
     */
    public RestructureResult restructure(List<ReferenceSite> sites, Map<String, String> rawNotes,
                                         ConversionOptions options, boolean appendToExistingBody) {
        options.validate();

        List<EditInstruction> edits = new ArrayList<>();
        List<ReferenceAnchor> anchors = new ArrayList<>();
        Map<String, ReferenceAnchor> anchorByNote = new LinkedHashMap<>();
        Map<String, String> incipitByNote = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();
        int nextBookmarkId = properties.getBookmarkIdStart();

        for (ReferenceSite site : sites) {
            String noteId = site.getNoteId();
            if (!NoteIds.isNoteId(noteId)) {
                if (!NoteIds.isSeparator(noteId)) {
                    log.warn("Skipping reference with non-numeric note id '{}' in paragraph {}",
                        noteId, site.getParagraphIndex());
                }
                continue;
            }

            String incipit = incipitLocator.locate(site.getParagraphText(), site.getOffset(), options.getWordCount());
            String bookmarkId = String.valueOf(nextBookmarkId++);
            String bookmarkName = uniqueBookmarkName(noteId, usedNames);

            edits.add(EditInstruction.builder()
                .type(EditType.INSERT_BOOKMARK)
                .paragraphIndex(site.getParagraphIndex())
                .inlineIndex(site.getInlineIndex())
                .noteId(noteId)
                .bookmarkId(bookmarkId)
                .bookmarkName(bookmarkName)
                .build());
            edits.add(EditInstruction.builder()
                .type(EditType.REMOVE_REFERENCE_MARKER)
                .paragraphIndex(site.getParagraphIndex())
                .inlineIndex(site.getInlineIndex())
                .noteId(noteId)
                .build());

            ReferenceAnchor anchor = new ReferenceAnchor(noteId, site.getOffset(), bookmarkId, bookmarkName);
            anchors.add(anchor);

            // Later references to the same note point back at the first one
            if (anchorByNote.putIfAbsent(noteId, anchor) != null) {
                log.debug("Note {} is referenced more than once; using first reference", noteId);
            }
            incipitByNote.putIfAbsent(noteId, incipit);
        }

        List<String> orderedIds = anchorByNote.keySet().stream()
            .sorted(NoteIds.NUMERIC_ORDER)
            .toList();

        logUnreferencedNotes(rawNotes, anchorByNote);

        CitationHistoryEngine engine = options.isApplyCitationStyle() ? engineFactory.newEngine() : null;
        List<NoteBlock> blocks = new ArrayList<>();

        for (String noteId : orderedIds) {
            String rawText = rawNotes.get(noteId);
            if (rawText == null) {
                log.warn("Reference to note {} has no matching endnote; skipping", noteId);
                continue;
            }
            blocks.add(renderNote(noteId, rawText, anchorByNote.get(noteId), incipitByNote.get(noteId),
                options, engine));
        }

        NotesSection section = NotesSection.builder()
            .heading(properties.getSectionHeading())
            .headingStyle(properties.getHeadingStyle())
            .pageBreakBefore(appendToExistingBody)
            .notes(blocks)
            .build();

        log.info("Planned {} edits and {} consolidated notes", edits.size(), blocks.size());

        return RestructureResult.builder()
            .edits(edits)
            .anchors(anchors)
            .notesSection(section)
            .notesProcessed(blocks.size())
            .build();
    }

    private NoteBlock renderNote(String noteId, String rawText, ReferenceAnchor anchor, String incipit,
                                 ConversionOptions options, CitationHistoryEngine engine) {
        NoteBlock.NoteBlockBuilder block = NoteBlock.builder()
            .noteId(noteId)
            .bookmarkName(anchor.getBookmarkName())
            .incipit(incipit)
            .emphasis(options.getEmphasisStyle())
            .rawText(rawText);

        if (engine == null) {
            return block.citation(rawText).build();
        }

        try {
            FormattedCitation formatted = engine.format(rawText);
            return block.citation(formatted.getText())
                .emission(formatted.getEmission())
                .build();
        } catch (RuntimeException e) {
            log.warn("Failed to format note {}, keeping original text: {}", noteId, e.getMessage());
            return block.citation(rawText)
                .fallback(true)
                .build();
        }
    }

    private String uniqueBookmarkName(String noteId, Set<String> usedNames) {
        String base = properties.getBookmarkPrefix() + noteId;
        String name = base;
        int suffix = 2;
        while (!usedNames.add(name)) {
            name = base + "_" + suffix++;
        }
        return name;
    }

    private void logUnreferencedNotes(Map<String, String> rawNotes, Map<String, ReferenceAnchor> anchorByNote) {
        long unreferenced = rawNotes.keySet().stream()
            .filter(NoteIds::isNoteId)
            .filter(id -> !anchorByNote.containsKey(id))
            .count();
        if (unreferenced > 0) {
            log.warn("{} endnotes are never referenced in the body and will be left out", unreferenced);
        }
    }
}

package com.dcruver.incipit.domain;

import com.dcruver.incipit.io.DocumentModel;
import com.dcruver.incipit.io.Inline;
import com.dcruver.incipit.io.InlineKind;
import com.dcruver.incipit.io.Paragraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every note reference in the body together with its paragraph text and offset.
 */
@Component
@Slf4j
public class ReferenceSiteExtractor {

    public List<ReferenceSite> extract(DocumentModel document) {
        if (document.getParagraphs() == null) {
            throw new DocumentStructureException("Document has no body paragraphs");
        }

        List<ReferenceSite> sites = new ArrayList<>();
        List<Paragraph> paragraphs = document.getParagraphs();

        for (int p = 0; p < paragraphs.size(); p++) {
            List<Inline> inlines = paragraphs.get(p).getInlines();
            if (inlines == null || inlines.isEmpty()) {
                continue;
            }

            StringBuilder paragraphText = new StringBuilder();
            for (Inline inline : inlines) {
                paragraphText.append(inline.visibleText());
            }

            int position = 0;
            for (int i = 0; i < inlines.size(); i++) {
                Inline inline = inlines.get(i);
                position += inline.visibleText().length();

                if (inline.getKind() != InlineKind.NOTE_REFERENCE) {
                    continue;
                }
                if (NoteIds.isSeparator(inline.getNoteId())) {
                    continue;
                }

                sites.add(ReferenceSite.builder()
                    .paragraphIndex(p)
                    .inlineIndex(i)
                    .paragraphText(paragraphText.toString())
                    .noteId(inline.getNoteId())
                    .offset(position)
                    .build());
            }
        }

        log.debug("Found {} note references", sites.size());
        return sites;
    }
}

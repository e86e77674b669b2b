package com.dcruver.incipit.io;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Word-processing document as exchanged with the packaging layer:
 * body paragraphs plus the endnotes they reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentModel {
    private List<Paragraph> paragraphs;
    private List<Endnote> endnotes;

    public Optional<Endnote> findEndnote(String id) {
        if (endnotes == null) {
            return Optional.empty();
        }
        return endnotes.stream()
            .filter(note -> id.equals(note.getId()))
            .findFirst();
    }
}

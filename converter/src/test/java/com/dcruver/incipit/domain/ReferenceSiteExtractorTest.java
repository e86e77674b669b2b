package com.dcruver.incipit.domain;

import com.dcruver.incipit.io.DocumentModel;
import com.dcruver.incipit.io.Inline;
import com.dcruver.incipit.io.Paragraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceSiteExtractorTest {

    private ReferenceSiteExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ReferenceSiteExtractor();
    }

    @Test
    void testFindsReferencesWithOffsets() {
        DocumentModel document = DocumentModel.builder()
            .paragraphs(List.of(
                Paragraph.of(Inline.text("Dr. Smith argued. He lost his case."), Inline.noteReference("1")),
                Paragraph.of(
                    Inline.text("The appeal failed."), Inline.noteReference("3"),
                    Inline.text(" Later, Mrs. Osheroff sued again."), Inline.noteReference("2"))))
            .endnotes(new ArrayList<>())
            .build();

        List<ReferenceSite> sites = extractor.extract(document);

        assertEquals(3, sites.size());

        assertEquals("1", sites.get(0).getNoteId());
        assertEquals(0, sites.get(0).getParagraphIndex());
        assertEquals(1, sites.get(0).getInlineIndex());
        assertEquals(35, sites.get(0).getOffset());

        assertEquals("3", sites.get(1).getNoteId());
        assertEquals(18, sites.get(1).getOffset());
        assertEquals("The appeal failed. Later, Mrs. Osheroff sued again.", sites.get(1).getParagraphText());

        assertEquals("2", sites.get(2).getNoteId());
        assertEquals(3, sites.get(2).getInlineIndex());
        assertEquals(51, sites.get(2).getOffset());
    }

    @Test
    void testVisibleReferenceTextCountsTowardOffset() {
        Inline reference = Inline.noteReference("4");
        reference.setText("4");
        DocumentModel document = DocumentModel.builder()
            .paragraphs(List.of(Paragraph.of(Inline.text("Short."), reference)))
            .build();

        ReferenceSite site = extractor.extract(document).get(0);

        assertEquals(7, site.getOffset());
        assertEquals("Short.4", site.getParagraphText());
    }

    @Test
    void testSkipsSeparatorReferences() {
        DocumentModel document = DocumentModel.builder()
            .paragraphs(List.of(Paragraph.of(
                Inline.text("Text."), Inline.noteReference("0"), Inline.noteReference("-1"), Inline.noteReference("5"))))
            .build();

        List<ReferenceSite> sites = extractor.extract(document);

        assertEquals(1, sites.size());
        assertEquals("5", sites.get(0).getNoteId());
        assertEquals(3, sites.get(0).getInlineIndex());
    }

    @Test
    void testMissingBodyIsStructuralError() {
        assertThrows(DocumentStructureException.class, () -> extractor.extract(new DocumentModel()));
    }
}

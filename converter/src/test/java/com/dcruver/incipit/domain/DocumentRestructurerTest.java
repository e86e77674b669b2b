package com.dcruver.incipit.domain;

import com.dcruver.incipit.citation.CitationHistoryEngine;
import com.dcruver.incipit.citation.CitationHistoryEngineFactory;
import com.dcruver.incipit.citation.CitationParser;
import com.dcruver.incipit.citation.Emission;
import com.dcruver.incipit.citation.FingerprintGenerator;
import com.dcruver.incipit.citation.FormattedCitation;
import com.dcruver.incipit.config.IncipitProperties;
import com.dcruver.incipit.domain.EditInstruction.EditType;
import com.dcruver.incipit.text.IncipitLocator;
import com.dcruver.incipit.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRestructurerTest {

    private static final String FREUD_45 = "Freud, S. The Interpretation of Dreams. New York: Macmillan, 1913, 45.";
    private static final String FREUD_60 = "Freud, S. The Interpretation of Dreams. New York: Macmillan, 1913, 60.";
    private static final String SZASZ = "Szasz, Thomas. The Myth of Mental Illness, 33.";

    private static final String P0 = "Dr. Smith argued. He lost his case.";
    private static final String P1 = "The appeal failed. Later, Mrs. Osheroff sued again.";

    private IncipitProperties properties;
    private TextNormalizer normalizer;
    private CitationParser parser;
    private FingerprintGenerator fingerprints;
    private DocumentRestructurer restructurer;
    private ConversionOptions options;

    @BeforeEach
    void setUp() {
        properties = new IncipitProperties();
        normalizer = new TextNormalizer();
        parser = new CitationParser(normalizer, properties);
        fingerprints = new FingerprintGenerator(512);
        restructurer = new DocumentRestructurer(new IncipitLocator(),
            new CitationHistoryEngineFactory(parser, fingerprints, normalizer), properties);
        options = ConversionOptions.from(properties);
    }

    private List<ReferenceSite> sampleSites() {
        return List.of(
            site(0, 1, P0, "1", 35),
            site(1, 1, P1, "3", 18),
            site(1, 3, P1, "2", 51));
    }

    private Map<String, String> sampleNotes() {
        return Map.of("1", FREUD_45, "2", FREUD_60, "3", SZASZ);
    }

    private static ReferenceSite site(int paragraph, int inline, String text, String noteId, int offset) {
        return ReferenceSite.builder()
            .paragraphIndex(paragraph)
            .inlineIndex(inline)
            .paragraphText(text)
            .noteId(noteId)
            .offset(offset)
            .build();
    }

    @Test
    void testPlansBookmarksInBodyOrder() {
        RestructureResult result = restructurer.restructure(sampleSites(), sampleNotes(), options, true);

        assertEquals(6, result.getEdits().size());
        assertEquals(3, result.getAnchors().size());

        ReferenceAnchor first = result.getAnchors().get(0);
        assertEquals("1", first.getNoteId());
        assertEquals("10000", first.getBookmarkId());
        assertEquals("REF_NOTE_1", first.getBookmarkName());
        assertEquals("10001", result.getAnchors().get(1).getBookmarkId());
        assertEquals("REF_NOTE_3", result.getAnchors().get(1).getBookmarkName());
        assertEquals("10002", result.getAnchors().get(2).getBookmarkId());

        EditInstruction insert = result.getEdits().get(0);
        assertEquals(EditType.INSERT_BOOKMARK, insert.getType());
        assertEquals(0, insert.getParagraphIndex());
        assertEquals(1, insert.getInlineIndex());
        assertEquals(EditType.REMOVE_REFERENCE_MARKER, result.getEdits().get(1).getType());
    }

    @Test
    void testNotesOrderedNumericallyWithIncipitsAndCitationStyle() {
        RestructureResult result = restructurer.restructure(sampleSites(), sampleNotes(), options, true);
        List<NoteBlock> notes = result.getNotesSection().getNotes();

        assertEquals(3, result.getNotesProcessed());
        assertEquals(List.of("1", "2", "3"), notes.stream().map(NoteBlock::getNoteId).toList());

        assertEquals("He lost his", notes.get(0).getIncipit());
        assertEquals("S. Freud, The Interpretation of Dreams (New York: Macmillan, 1913), 45", notes.get(0).getCitation());
        assertEquals(Emission.FULL, notes.get(0).getEmission());

        assertEquals("Later, Mrs. Osheroff", notes.get(1).getIncipit());
        assertEquals("Ibid., 60", notes.get(1).getCitation());
        assertEquals("REF_NOTE_2", notes.get(1).getBookmarkName());

        assertEquals("The appeal failed", notes.get(2).getIncipit());
        assertEquals("Thomas Szasz, The Myth of Mental Illness, 33", notes.get(2).getCitation());
        assertEquals(EmphasisStyle.BOLD, notes.get(2).getEmphasis());
    }

    @Test
    void testSectionHeadingAndPageBreak() {
        NotesSection withBody = restructurer.restructure(sampleSites(), sampleNotes(), options, true).getNotesSection();
        NotesSection emptyBody = restructurer.restructure(sampleSites(), sampleNotes(), options, false).getNotesSection();

        assertEquals("Notes", withBody.getHeading());
        assertEquals("Heading1", withBody.getHeadingStyle());
        assertTrue(withBody.isPageBreakBefore());
        assertFalse(emptyBody.isPageBreakBefore());
    }

    @Test
    void testEachCallHasFreshHistory() {
        restructurer.restructure(sampleSites(), sampleNotes(), options, true);
        RestructureResult second = restructurer.restructure(sampleSites(), sampleNotes(), options, true);

        assertEquals(Emission.FULL, second.getNotesSection().getNotes().get(0).getEmission());
    }

    @Test
    void testStyleDisabledKeepsRawText() {
        RestructureResult result = restructurer.restructure(sampleSites(), sampleNotes(),
            options.withApplyCitationStyle(false), true);

        NoteBlock first = result.getNotesSection().getNotes().get(0);
        assertEquals(FREUD_45, first.getCitation());
        assertNull(first.getEmission());
        assertFalse(first.isFallback());
    }

    @Test
    void testWordCountAndEmphasisOptions() {
        RestructureResult result = restructurer.restructure(sampleSites(), sampleNotes(),
            options.withWordCount(1).withEmphasisStyle(EmphasisStyle.ITALIC), true);

        NoteBlock first = result.getNotesSection().getNotes().get(0);
        assertEquals("He", first.getIncipit());
        assertEquals(EmphasisStyle.ITALIC, first.getEmphasis());
    }

    @Test
    void testFormattingFailureFallsBackToRawText() {
        CitationParser sharedParser = parser;
        FingerprintGenerator sharedFingerprints = fingerprints;
        TextNormalizer sharedNormalizer = normalizer;
        CitationHistoryEngineFactory failing = new CitationHistoryEngineFactory(sharedParser, sharedFingerprints,
                sharedNormalizer) {
            @Override
            public CitationHistoryEngine newEngine() {
                return new CitationHistoryEngine(sharedParser, sharedFingerprints, sharedNormalizer) {
                    @Override
                    public FormattedCitation format(String rawText) {
                        if (rawText.startsWith("Szasz")) {
                            throw new IllegalStateException("unparseable");
                        }
                        return super.format(rawText);
                    }
                };
            }
        };
        DocumentRestructurer tolerant = new DocumentRestructurer(new IncipitLocator(), failing, properties);

        List<NoteBlock> notes = tolerant.restructure(sampleSites(), sampleNotes(), options, true)
            .getNotesSection().getNotes();

        assertEquals(3, notes.size());
        assertFalse(notes.get(0).isFallback());
        assertTrue(notes.get(2).isFallback());
        assertEquals(SZASZ, notes.get(2).getCitation());
    }

    @Test
    void testRepeatedReferenceGetsUniqueBookmarkAndFirstIncipit() {
        List<ReferenceSite> sites = List.of(
            site(0, 1, P0, "1", 35),
            site(1, 1, P1, "1", 18));

        RestructureResult result = restructurer.restructure(sites, Map.of("1", FREUD_45), options, true);

        assertEquals(4, result.getEdits().size());
        assertEquals("REF_NOTE_1", result.getAnchors().get(0).getBookmarkName());
        assertEquals("REF_NOTE_1_2", result.getAnchors().get(1).getBookmarkName());

        List<NoteBlock> notes = result.getNotesSection().getNotes();
        assertEquals(1, notes.size());
        assertEquals("REF_NOTE_1", notes.get(0).getBookmarkName());
        assertEquals("He lost his", notes.get(0).getIncipit());
    }

    @Test
    void testNoteIdsSortNumerically() {
        List<ReferenceSite> sites = List.of(
            site(0, 1, P0, "10", 35),
            site(1, 1, P1, "9", 18));

        RestructureResult result = restructurer.restructure(sites, Map.of("9", SZASZ, "10", FREUD_45), options, true);

        assertEquals(List.of("9", "10"),
            result.getNotesSection().getNotes().stream().map(NoteBlock::getNoteId).toList());
    }

    @Test
    void testSkipsUnusableReferencesAndMissingNotes() {
        List<ReferenceSite> sites = List.of(
            site(0, 1, P0, "abc", 35),
            site(1, 1, P1, "7", 18),
            site(1, 3, P1, "3", 51));

        RestructureResult result = restructurer.restructure(sites, Map.of("3", SZASZ), options, true);

        // "7" keeps its bookmark but has no note text
        assertEquals(4, result.getEdits().size());
        assertEquals(1, result.getNotesProcessed());
        assertEquals("3", result.getNotesSection().getNotes().get(0).getNoteId());
    }

    @Test
    void testInvalidWordCountIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> restructurer.restructure(sampleSites(), sampleNotes(), options.withWordCount(0), true));
    }
}

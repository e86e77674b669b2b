package com.dcruver.incipit.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteIdsTest {

    @Test
    void testSeparators() {
        assertTrue(NoteIds.isSeparator(null));
        assertTrue(NoteIds.isSeparator("0"));
        assertTrue(NoteIds.isSeparator("-1"));
        assertTrue(NoteIds.isSeparator("00"));
        assertFalse(NoteIds.isSeparator("1"));
        assertFalse(NoteIds.isSeparator("abc"));
    }

    @Test
    void testNoteIds() {
        assertTrue(NoteIds.isNoteId("1"));
        assertTrue(NoteIds.isNoteId("012"));
        assertFalse(NoteIds.isNoteId("00"));
        assertFalse(NoteIds.isNoteId("-1"));
        assertFalse(NoteIds.isNoteId("1a"));
        assertFalse(NoteIds.isNoteId(null));
    }

    @Test
    void testNumericOrderIgnoresLeadingZeros() {
        List<String> ids = new ArrayList<>(List.of("10", "01", "2", "9"));

        ids.sort(NoteIds.NUMERIC_ORDER);

        assertEquals(List.of("01", "2", "9", "10"), ids);
    }
}

package com.dcruver.incipit.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IncipitLocatorTest {

    private final IncipitLocator locator = new IncipitLocator();

    @Test
    void testDoesNotBreakAfterTitleAbbreviation() {
        String text = "Dr. Smith argued. He lost his case.";

        assertEquals("Dr. Smith argued", locator.locate(text, "Dr. Smith argued.".length(), 3));
        assertEquals("He lost his", locator.locate(text, text.length(), 3));
    }

    @Test
    void testDoesNotBreakAfterVersus() {
        String text = "Earlier text. The court in Osheroff v. Chestnut Lodge agreed.";

        assertEquals("The court in Osheroff", locator.locate(text, text.length(), 4));
    }

    @Test
    void testSkipsHonorificsInsideSentence() {
        String text = "Mrs. Osheroff testified. Then Mr. Klerman spoke.";

        assertEquals("Then Mr. Klerman", locator.locate(text, text.length(), 3));
    }

    @Test
    void testQuestionAndExclamationMarksEndSentences() {
        assertEquals("Because the", locator.locate("Why now? Because the law changed.", 33, 2));
        assertEquals("Nobody listened", locator.locate("Stop! Nobody listened.", 22, 2));
    }

    @Test
    void testUsesTextBeforeOffsetOnly() {
        String text = "First point. Second point here. Third point.";
        int offset = text.indexOf("Third") - 1;

        assertEquals("Second point here", locator.locate(text, offset, 5));
    }

    @Test
    void testStripsQuotes() {
        assertEquals("Freedom is", locator.locate("\"Freedom is fragile,\" he wrote.", 30, 2));
        assertEquals("Liberty matters", locator.locate("“Liberty matters,” she said.", 28, 2));
    }

    @Test
    void testReturnsEmptyWhenNothingPrecedes() {
        assertEquals("", locator.locate("Some text.", 0, 3));
        assertEquals("", locator.locate("", 5, 3));
        assertEquals("", locator.locate("   ", 3, 3));
    }

    @Test
    void testClampsOffsetToParagraph() {
        assertEquals("Short", locator.locate("Short.", 100, 3));
    }

    @Test
    void testRejectsNonPositiveWordCount() {
        assertThrows(IllegalArgumentException.class, () -> locator.locate("Text.", 5, 0));
    }

    @Test
    void testIsDeterministic() {
        String text = "Dr. Smith argued. He lost his case.";
        assertEquals(locator.locate(text, 20, 3), locator.locate(text, 20, 3));
    }
}

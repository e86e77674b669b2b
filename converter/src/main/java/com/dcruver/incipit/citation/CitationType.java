package com.dcruver.incipit.citation;

/**
 * Kinds of citation recognised by the parser.
 */
public enum CitationType {
    /**
     * Archive boxes, papers, collections, arbitration recordings
     */
    ARCHIVAL,

    /**
     * Depositions, testimony and transcripts
     */
    TRANSCRIPT,

    /**
     * Case law ("Party v. Party")
     */
    LEGAL,

    /**
     * Articles in a known medical or psychiatric journal
     */
    MEDICAL,

    /**
     * Monographs with a "City: Publisher, Year" block
     */
    BOOK,

    /**
     * "Last, First. Title" citations without a publication block
     */
    JOURNAL,

    /**
     * Anything else; the whole text is the title
     */
    GENERIC
}

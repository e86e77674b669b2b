package com.dcruver.incipit.citation;

/**
 * Which citation form the history engine chose for a note.
 */
public enum Emission {
    /**
     * First citation of a work
     */
    FULL,

    /**
     * Later, non-adjacent citation of a work already cited in full
     */
    SHORT,

    /**
     * Same work as the immediately preceding citation
     */
    IBID,

    /**
     * Nothing identifiable; cleaned text returned as is
     */
    PASS_THROUGH
}

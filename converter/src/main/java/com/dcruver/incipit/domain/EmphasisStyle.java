package com.dcruver.incipit.domain;

/**
 * Styling applied to the incipit label of a consolidated note.
 */
public enum EmphasisStyle {
    BOLD,
    ITALIC
}

package com.dcruver.incipit.domain;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules for endnote ids. "-1" and any id numerically equal to 0 are separator
 * notes, never real notes.
 */
public final class NoteIds {

    static final Set<String> SEPARATOR_IDS = Set.of("0", "-1");

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /**
     * Numeric order of note ids; only valid for ids accepted by {@link #isNoteId}.
     * Ties such as "7" and "07" fall back to string order.
     */
    public static final Comparator<String> NUMERIC_ORDER = Comparator
        .comparing((String id) -> new BigInteger(id))
        .thenComparing(Comparator.naturalOrder());

    private NoteIds() {
    }

    public static boolean isSeparator(String id) {
        if (id == null || SEPARATOR_IDS.contains(id)) {
            return true;
        }
        return DIGITS.matcher(id).matches() && new BigInteger(id).signum() == 0;
    }

    /**
     * A processable note id: digits only and not a separator.
     */
    public static boolean isNoteId(String id) {
        return !isSeparator(id) && DIGITS.matcher(id).matches();
    }
}

package com.dcruver.incipit.citation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of trying one matcher against citation text.
 * A faulted outcome behaves like no match but keeps the cause for diagnostics.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MatchOutcome {

    public enum Status {
        MATCHED,
        NO_MATCH,
        FAULTED
    }

    private static final MatchOutcome NO_MATCH = new MatchOutcome(Status.NO_MATCH, null, null);

    private final Status status;
    private final CitationRecord record;
    private final Throwable cause;

    public static MatchOutcome matched(CitationRecord record) {
        return new MatchOutcome(Status.MATCHED, record, null);
    }

    public static MatchOutcome noMatch() {
        return NO_MATCH;
    }

    public static MatchOutcome faulted(Throwable cause) {
        return new MatchOutcome(Status.FAULTED, null, cause);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case MATCHED -> "MATCHED(" + record.getType() + ")";
            case NO_MATCH -> "NO_MATCH";
            case FAULTED -> "FAULTED(" + cause.getMessage() + ")";
        };
    }
}

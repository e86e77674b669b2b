package com.dcruver.incipit.citation;

import com.dcruver.incipit.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Chooses between a full note, a short note and "Ibid." for each citation of one document.
 *
 * Citations must be fed in ascending note-id order. An instance holds the
 * history of a single document and must not be reused for another one; it is
 * not thread-safe.
 */
@Slf4j
public class CitationHistoryEngine {

    public static final String IBID = "Ibid.";

    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(The|A|An)\\s+");
    private static final int SHORT_TITLE_WORDS = 5;

    private final CitationParser parser;
    private final FingerprintGenerator fingerprints;
    private final TextNormalizer normalizer;

    private final List<HistoryEntry> history = new ArrayList<>();
    private final Map<String, CitationRecord> seenWorks = new HashMap<>();

    public CitationHistoryEngine(CitationParser parser, FingerprintGenerator fingerprints, TextNormalizer normalizer) {
        this.parser = parser;
        this.fingerprints = fingerprints;
        this.normalizer = normalizer;
    }

    /**
     * Format the next citation of the document.
     */
    public String process(String rawText) {
        return format(rawText).getText();
    }

    /**
     * Format the next citation and report which form was chosen.
     */
    public FormattedCitation format(String rawText) {
        CitationRecord parsed = parser.parse(rawText);

        if (!parsed.isIdentifiable()) {
            log.debug("No author or title in \"{}\", passing through", rawText);
            return FormattedCitation.builder()
                .text(normalizer.normalize(rawText))
                .emission(Emission.PASS_THROUGH)
                .build();
        }

        String fingerprint = fingerprints.fingerprint(parsed.getAuthor(), parsed.getTitle());
        CitationRecord record = parsed.withFingerprint(fingerprint);

        Emission emission;
        String text;
        if (fingerprint != null && isSameAsPrevious(fingerprint)) {
            emission = Emission.IBID;
            text = IBID;
        } else if (fingerprint != null && seenWorks.containsKey(fingerprint)) {
            emission = Emission.SHORT;
            text = shortNote(record, seenWorks.get(fingerprint));
        } else {
            // Author-only records have no fingerprint and are always cited in full
            if (fingerprint != null) {
                seenWorks.put(fingerprint, record);
            }
            emission = Emission.FULL;
            text = fullNote(record);
        }

        if (record.hasPage()) {
            text = text + ", " + record.getPage();
        }

        history.add(new HistoryEntry(record, fingerprint, emission));
        log.debug("{} note for {} ({})", emission, fingerprint, record.getType());

        return FormattedCitation.builder()
            .text(text)
            .emission(emission)
            .record(record)
            .build();
    }

    private boolean isSameAsPrevious(String fingerprint) {
        return !history.isEmpty() && fingerprint.equals(history.get(history.size() - 1).getFingerprint());
    }

    private String shortNote(CitationRecord record, CitationRecord firstSeen) {
        return switch (record.getType()) {
            case LEGAL -> beforeFirstComma(record.getTitle());
            case ARCHIVAL, TRANSCRIPT -> record.getTitle();
            default -> {
                String shortTitle = shortTitle(firstSeen.getTitle());
                yield record.hasAuthor() ? record.getAuthor() + ", " + shortTitle : shortTitle;
            }
        };
    }

    private String fullNote(CitationRecord record) {
        String authorPrefix = record.hasAuthor() ? record.getAuthor() + ", " : "";
        String title = record.hasTitle() ? record.getTitle() : "";

        return switch (record.getType()) {
            case LEGAL -> title;
            case ARCHIVAL -> title + ", " + nullToEmpty(record.getDetails());
            case BOOK -> record.getPublication() != null
                ? authorPrefix + title + " (" + record.getPublication() + ")"
                : authorPrefix + title;
            case MEDICAL -> authorPrefix + title + " " + nullToEmpty(record.getPublication());
            default -> authorPrefix + title;
        };
    }

    /**
     * Short title of a work: subtitle after a colon dropped, leading article
     * dropped, at most five words.
     */
    public static String shortTitle(String fullTitle) {
        if (fullTitle == null || fullTitle.isBlank()) {
            return "";
        }

        int colon = fullTitle.indexOf(':');
        String shortened = colon >= 0 ? fullTitle.substring(0, colon) : fullTitle;
        shortened = LEADING_ARTICLE.matcher(shortened.strip()).replaceFirst("");

        String[] words = shortened.split("\\s+");
        if (words.length > SHORT_TITLE_WORDS) {
            return String.join(" ", List.of(words).subList(0, SHORT_TITLE_WORDS));
        }
        return shortened.strip();
    }

    private static String beforeFirstComma(String text) {
        int comma = text.indexOf(',');
        return comma >= 0 ? text.substring(0, comma) : text;
    }

    private static String nullToEmpty(String text) {
        return text != null ? text : "";
    }

    /**
     * Citations processed so far, in document order.
     */
    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * First record seen for the given fingerprint, or null.
     */
    public CitationRecord getFirstSeen(String fingerprint) {
        return seenWorks.get(fingerprint);
    }
}

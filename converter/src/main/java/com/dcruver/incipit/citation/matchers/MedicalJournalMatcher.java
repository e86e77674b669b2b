package com.dcruver.incipit.citation.matchers;

import com.dcruver.incipit.citation.CitationMatcher;
import com.dcruver.incipit.citation.CitationRecord;
import com.dcruver.incipit.citation.CitationText;
import com.dcruver.incipit.citation.CitationType;
import com.dcruver.incipit.citation.MatchOutcome;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Articles in known medical journals: "Author. Title. Journal Year;Vol:Pages".
 */
public class MedicalJournalMatcher implements CitationMatcher {

    private static final Pattern ET_AL = Pattern.compile("\\bet\\s+al\\.?", Pattern.CASE_INSENSITIVE);
    private static final String ET_AL_FORM = "et al.";
    private static final String UNKNOWN_TITLE = "Title Unknown";

    private final List<String> journals;

    public MedicalJournalMatcher(List<String> journals) {
        this.journals = List.copyOf(journals);
    }

    @Override
    public String getName() {
        return "medical";
    }

    @Override
    public MatchOutcome match(String text) {
        Optional<String> journal = journals.stream()
            .filter(text::contains)
            .max(Comparator.comparingInt(String::length));

        if (journal.isEmpty()) {
            return MatchOutcome.noMatch();
        }

        String name = journal.get();
        int at = text.indexOf(name);
        String preJournal = text.substring(0, at).strip();
        String postJournal = text.substring(at + name.length()).strip();

        String[] parts = CitationText.splitFirstSentence(preJournal);
        String author = CitationText.emptyToNull(parts[0].strip());
        String title = parts.length > 1 ? CitationText.strip(parts[1].strip(), " .") : UNKNOWN_TITLE;

        if (author != null) {
            author = ET_AL.matcher(author).replaceAll(ET_AL_FORM);
            if (author.contains(",") && !author.contains(ET_AL_FORM)) {
                author = CitationText.reorderName(author);
            }
        }

        String publication = postJournal.isEmpty() ? name : name + " " + postJournal;

        return MatchOutcome.matched(CitationRecord.builder()
            .raw(text)
            .type(CitationType.MEDICAL)
            .author(author)
            .title(CitationText.emptyToNull(title))
            .publication(publication)
            .build());
    }
}

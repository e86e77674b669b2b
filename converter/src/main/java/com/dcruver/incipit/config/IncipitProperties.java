package com.dcruver.incipit.config;

import com.dcruver.incipit.domain.EmphasisStyle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion settings bound from {@code incipit.*}.
 */
@ConfigurationProperties(prefix = "incipit")
@Data
public class IncipitProperties {

    /**
     * Journal names recognised by the medical citation matcher.
     */
    public static final List<String> DEFAULT_MEDICAL_JOURNALS = List.of(
        "Am J Psychiatry", "American Journal of Psychiatry",
        "JAMA", "NEJM", "New England Journal of Medicine",
        "Arch Gen Psychiatry", "Archives of General Psychiatry",
        "Lancet", "BMJ", "British Medical Journal",
        "Psychiatric Services", "J Clin Psychiatry", "Journal of Clinical Psychiatry",
        "Biological Psychiatry", "Psychological Medicine",
        "Hospital and Community Psychiatry", "Bulletin of the Menninger Clinic",
        "J Nerv Ment Dis", "Journal of Nervous and Mental Disease"
    );

    private int wordCount = 3;
    private EmphasisStyle emphasisStyle = EmphasisStyle.BOLD;
    private boolean applyCitationStyle = true;

    private int bookmarkIdStart = 10000;
    private String bookmarkPrefix = "REF_NOTE_";
    private String sectionHeading = "Notes";
    private String headingStyle = "Heading1";

    private int fingerprintCacheSize = 512;
    private List<String> medicalJournals = new ArrayList<>(DEFAULT_MEDICAL_JOURNALS);
}

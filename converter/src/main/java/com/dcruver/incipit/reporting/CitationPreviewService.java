package com.dcruver.incipit.reporting;

import com.dcruver.incipit.citation.CitationHistoryEngine;
import com.dcruver.incipit.citation.CitationHistoryEngineFactory;
import com.dcruver.incipit.citation.FormattedCitation;
import com.dcruver.incipit.domain.NoteIds;
import com.dcruver.incipit.io.DocumentModel;
import com.dcruver.incipit.io.DocumentModelReader;
import com.dcruver.incipit.io.Endnote;
import com.dcruver.incipit.io.NotesDiffWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shows how each endnote would be restyled without touching the document.
 * Notes are taken in the order they appear in the endnotes part.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CitationPreviewService {

    private final DocumentModelReader reader;
    private final CitationHistoryEngineFactory engineFactory;
    private final NotesDiffWriter diffWriter;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public PreviewReport preview(Path documentPath) throws IOException {
        return preview(reader.read(documentPath), documentPath.getFileName().toString());
    }

    public PreviewReport preview(DocumentModel document, String documentName) {
        List<CitationPreview> changes = new ArrayList<>();
        CitationHistoryEngine engine = engineFactory.newEngine();

        List<Endnote> endnotes = document.getEndnotes() != null ? document.getEndnotes() : List.of();
        for (Endnote endnote : endnotes) {
            if (NoteIds.isSeparator(endnote.getId())) {
                continue;
            }

            String raw = endnote.getRawText();
            if (raw.isBlank()) {
                continue;
            }

            FormattedCitation formatted = engine.format(raw);
            changes.add(CitationPreview.builder()
                .id(endnote.getId())
                .raw(raw)
                .processed(formatted.getText())
                .type(formatted.getRecord() != null ? formatted.getRecord().getType() : null)
                .fingerprint(formatted.getRecord() != null ? formatted.getRecord().getFingerprint() : null)
                .emission(formatted.getEmission())
                .build());
        }

        log.info("Previewed {} notes of {}", changes.size(), documentName);
        return PreviewReport.builder()
            .documentName(documentName)
            .generatedAt(Instant.now())
            .changes(changes)
            .build();
    }

    /**
     * Unified diff of raw against processed notes, one line per note.
     */
    public String renderDiff(PreviewReport report) {
        List<String> original = report.getChanges().stream()
            .map(change -> change.getId() + ". " + change.getRaw())
            .toList();
        List<String> converted = report.getChanges().stream()
            .map(change -> change.getId() + ". " + change.getProcessed())
            .toList();
        return diffWriter.generateDiff(original, converted, report.getDocumentName());
    }

    public String toJson(PreviewReport report) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    public void writeJson(PreviewReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(report));
        log.info("Wrote preview report: {}", outputPath);
    }
}

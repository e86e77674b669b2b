package com.dcruver.incipit.domain;

import com.dcruver.incipit.io.DocumentModel;
import com.dcruver.incipit.io.DocumentModelReader;
import com.dcruver.incipit.io.DocumentModelWriter;
import com.dcruver.incipit.io.Endnote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts one document: read, plan, apply, write.
 * On failure nothing is written and the input is left untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentConverter {

    private final DocumentModelReader reader;
    private final DocumentModelWriter writer;
    private final ReferenceSiteExtractor siteExtractor;
    private final DocumentRestructurer restructurer;
    private final DocumentEditApplier applier;

    public ConversionResult convert(Path inputPath, Path outputPath, ConversionOptions options) {
        log.info("Converting {} -> {}", inputPath, outputPath);

        try {
            DocumentModel document = reader.read(inputPath);
            RestructureResult result = convert(document, options);
            writer.write(document, outputPath);

            String message = String.format("Converted %d notes", result.getNotesProcessed());
            log.info(message);
            return ConversionResult.builder()
                .success(true)
                .message(message)
                .notesProcessed(result.getNotesProcessed())
                .outputPath(outputPath)
                .build();

        } catch (IOException | RuntimeException e) {
            log.error("Conversion of {} failed", inputPath, e);
            return ConversionResult.builder()
                .success(false)
                .message(e.getMessage())
                .build();
        }
    }

    /**
     * Rewrite an in-memory document and return the applied plan.
     *
     * @throws DocumentStructureException if the document lacks body or endnotes
     */
    public RestructureResult convert(DocumentModel document, ConversionOptions options) {
        if (document.getEndnotes() == null) {
            throw new DocumentStructureException("Document has no endnotes");
        }

        List<ReferenceSite> sites = siteExtractor.extract(document);
        boolean existingBody = !document.getParagraphs().isEmpty();

        RestructureResult result = restructurer.restructure(sites, rawNotes(document), options, existingBody);
        applier.apply(document, result);
        return result;
    }

    private Map<String, String> rawNotes(DocumentModel document) {
        Map<String, String> notes = new LinkedHashMap<>();
        for (Endnote endnote : document.getEndnotes()) {
            if (NoteIds.isSeparator(endnote.getId())) {
                continue;
            }
            notes.putIfAbsent(endnote.getId(), endnote.getRawText());
        }
        return notes;
    }
}

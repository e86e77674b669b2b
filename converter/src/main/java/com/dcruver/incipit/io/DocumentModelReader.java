package com.dcruver.incipit.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a JSON document model produced by the packaging layer.
 */
@Component
@Slf4j
public class DocumentModelReader {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Read and parse a document model file
     */
    public DocumentModel read(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("Document not found: " + filePath);
        }

        DocumentModel document = objectMapper.readValue(filePath.toFile(), DocumentModel.class);
        log.debug("Read document {}: {} paragraphs, {} endnotes", filePath.getFileName(),
            document.getParagraphs() != null ? document.getParagraphs().size() : 0,
            document.getEndnotes() != null ? document.getEndnotes().size() : 0);
        return document;
    }
}

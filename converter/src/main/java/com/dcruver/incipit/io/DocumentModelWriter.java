package com.dcruver.incipit.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a document model back to JSON.
 * An existing output file is kept as {@code <name>.bak}.
 */
@Component
@Slf4j
public class DocumentModelWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Write a document model to file
     */
    public void write(DocumentModel document, Path outputPath) throws IOException {
        // Create backup if file exists
        if (Files.exists(outputPath)) {
            Path backup = outputPath.resolveSibling(outputPath.getFileName() + ".bak");
            Files.copy(outputPath, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Backed up {} to {}", outputPath, backup);
        }

        String content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Files.writeString(outputPath, content.endsWith("\n") ? content : content + "\n");
        log.debug("Wrote document to: {}", outputPath);
    }
}

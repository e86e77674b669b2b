package com.dcruver.incipit.domain;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of converting one document file.
 */
@Value
@Builder
public class ConversionResult {
    boolean success;
    String message;
    int notesProcessed;
    Path outputPath;
}

package com.dcruver.incipit.io;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the change from raw to converted notes as a unified diff, one note per line.
 */
@Component
public class NotesDiffWriter {

    private static final int CONTEXT_LINES = 0;

    /**
     * Generate a unified diff between two listings of note lines
     */
    public String generateDiff(List<String> originalLines, List<String> revisedLines, String documentName) {
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "original/" + documentName,
            "converted/" + documentName,
            originalLines,
            patch,
            CONTEXT_LINES
        );

        return String.join("\n", unifiedDiff);
    }
}

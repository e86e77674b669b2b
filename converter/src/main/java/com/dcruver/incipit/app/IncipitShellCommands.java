package com.dcruver.incipit.app;

import com.dcruver.incipit.citation.Emission;
import com.dcruver.incipit.citation.FingerprintGenerator;
import com.dcruver.incipit.config.IncipitProperties;
import com.dcruver.incipit.domain.ConversionOptions;
import com.dcruver.incipit.domain.ConversionResult;
import com.dcruver.incipit.domain.DocumentConverter;
import com.dcruver.incipit.domain.EmphasisStyle;
import com.dcruver.incipit.reporting.CitationPreview;
import com.dcruver.incipit.reporting.CitationPreviewService;
import com.dcruver.incipit.reporting.PreviewReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Spring Shell commands for converting documents and previewing citations.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class IncipitShellCommands {

    private final DocumentConverter converter;
    private final CitationPreviewService previewService;
    private final FingerprintGenerator fingerprintGenerator;
    private final IncipitProperties properties;

    @ShellMethod(key = "convert", value = "Move endnotes into an incipit-labelled notes section")
    public String convert(
            @ShellOption String input,
            @ShellOption String output,
            @ShellOption(value = "--word-count", defaultValue = ShellOption.NULL) Integer wordCount,
            @ShellOption(defaultValue = ShellOption.NULL) String emphasis,
            @ShellOption(value = "--apply-style", defaultValue = ShellOption.NULL) Boolean applyStyle) {
        try {
            ConversionOptions options = ConversionOptions.from(properties);
            if (wordCount != null) {
                options = options.withWordCount(wordCount);
            }
            if (emphasis != null) {
                options = options.withEmphasisStyle(EmphasisStyle.valueOf(emphasis.toUpperCase(Locale.ROOT)));
            }
            if (applyStyle != null) {
                options = options.withApplyCitationStyle(applyStyle);
            }

            ConversionResult result = converter.convert(Path.of(input), Path.of(output), options);
            if (!result.isSuccess()) {
                return "Conversion failed: " + result.getMessage() + "\nThe original document was not modified.";
            }

            StringBuilder sb = new StringBuilder();
            sb.append("✓ ").append(result.getMessage()).append("\n\n");
            sb.append(String.format("Output: %s\n", result.getOutputPath()));
            sb.append(String.format("Incipit words: %d\n", options.getWordCount()));
            sb.append(String.format("Incipit style: %s\n", options.getEmphasisStyle()));
            sb.append(String.format("Citation style applied: %s\n", options.isApplyCitationStyle() ? "yes" : "no"));
            return sb.toString();

        } catch (Exception e) {
            log.error("Convert failed", e);
            return "Conversion failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "preview", value = "Show how each endnote would be restyled")
    public String preview(
            @ShellOption String input,
            @ShellOption(defaultValue = "false") boolean diff,
            @ShellOption(defaultValue = ShellOption.NULL) String json) {
        try {
            PreviewReport report = previewService.preview(Path.of(input));

            if (json != null) {
                previewService.writeJson(report, Path.of(json));
            }

            if (report.getChanges().isEmpty()) {
                return "No endnotes found in " + report.getDocumentName();
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Citation preview for %s\n\n", report.getDocumentName()));

            if (diff) {
                sb.append(previewService.renderDiff(report)).append("\n\n");
            } else {
                for (CitationPreview change : report.getChanges()) {
                    sb.append(String.format("%s. [%s] %s\n", change.getId(), change.getEmission(),
                        change.getProcessed()));
                    if (!change.getRaw().equals(change.getProcessed())) {
                        sb.append(String.format("   was: %s\n", truncate(change.getRaw(), 120)));
                    }
                }
                sb.append("\n");
            }

            sb.append(String.format("Total: %d notes (%d full, %d short, %d ibid, %d unchanged)\n",
                report.getChanges().size(),
                report.count(Emission.FULL),
                report.count(Emission.SHORT),
                report.count(Emission.IBID),
                report.count(Emission.PASS_THROUGH)));
            if (json != null) {
                sb.append(String.format("Report written to: %s\n", json));
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Preview failed", e);
            return "Preview failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "fingerprints stats", value = "Show fingerprint cache statistics")
    public String fingerprintStats() {
        FingerprintGenerator.Stats stats = fingerprintGenerator.getStats();

        StringBuilder sb = new StringBuilder();
        sb.append("Fingerprint Cache Statistics\n\n");
        sb.append(String.format("Entries: %d / %d\n", stats.getSize(), stats.getMaxEntries()));
        sb.append(String.format("Hits: %d\n", stats.getHits()));
        sb.append(String.format("Misses: %d\n", stats.getMisses()));
        return sb.toString();
    }

    @ShellMethod(key = "fingerprints clear", value = "Clear the fingerprint cache")
    public String fingerprintClear() {
        fingerprintGenerator.clear();
        return "Fingerprint cache cleared.";
    }

    private String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}

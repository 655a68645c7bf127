package de.conciso.medcontext.report;

import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.InteractionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Schreibt Reports nach {@code <outputPath>/<baseName>/<baseName>.{json,md}}.
 * baseName ist das Run-Label, sonst Präfix + Zeitstempel.
 */
@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    private final String outputPath;
    private final String runLabel;
    private final JsonReportWriter jsonReportWriter;
    private final MarkdownReportWriter markdownReportWriter;

    public ReportWriter(
            @Value("${medcontext.output.path:reports}") String outputPath,
            @Value("${medcontext.run.label:}") String runLabel,
            JsonReportWriter jsonReportWriter,
            MarkdownReportWriter markdownReportWriter
    ) {
        this.outputPath = outputPath;
        this.runLabel = runLabel;
        this.jsonReportWriter = jsonReportWriter;
        this.markdownReportWriter = markdownReportWriter;
    }

    public Optional<Path> write(InteractionReport report) {
        Instant now = Instant.now();
        String baseName = baseName("interaction", now);
        try {
            Path dir = prepare(baseName);

            Path jsonPath = dir.resolve(baseName + ".json");
            jsonReportWriter.write(report, now, jsonPath);
            log.info("JSON report written: {}", jsonPath);

            Path mdPath = dir.resolve(baseName + ".md");
            markdownReportWriter.write(report, now, mdPath);
            log.info("Markdown report written: {}", mdPath);
            return Optional.of(dir);
        } catch (IOException e) {
            log.error("Failed to write interaction report", e);
            return Optional.empty();
        }
    }

    public Optional<Path> write(ContextBundle bundle, String caseId) {
        Instant now = Instant.now();
        String baseName = baseName("context", now);
        try {
            Path dir = prepare(baseName);

            Path jsonPath = dir.resolve(baseName + ".json");
            jsonReportWriter.write(bundle, caseId, now, jsonPath);
            log.info("JSON report written: {}", jsonPath);

            Path mdPath = dir.resolve(baseName + ".md");
            markdownReportWriter.write(bundle, caseId, now, mdPath);
            log.info("Markdown report written: {}", mdPath);
            return Optional.of(dir);
        } catch (IOException e) {
            log.error("Failed to write context report", e);
            return Optional.empty();
        }
    }

    private String baseName(String prefix, Instant now) {
        return (runLabel != null && !runLabel.isBlank())
                ? runLabel
                : prefix + "_" + TIMESTAMP_FORMAT.format(now);
    }

    private Path prepare(String baseName) throws IOException {
        Path dir = Path.of(outputPath).resolve(baseName);
        Files.createDirectories(dir);
        return dir;
    }
}

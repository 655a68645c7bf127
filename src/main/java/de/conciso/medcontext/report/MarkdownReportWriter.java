package de.conciso.medcontext.report;

import de.conciso.medcontext.model.BundleEntry;
import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.InteractionReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

@Component
public class MarkdownReportWriter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public void write(InteractionReport report, Instant timestamp, Path path) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("# Interaction Report — ")
                .append(report.subjectA()).append(" vs ").append(report.subjectB())
                .append("\n\n");
        sb.append("Erstellt: ").append(DISPLAY_FORMAT.format(timestamp)).append("\n\n");

        sb.append("| Metrik | Wert |\n|---|---|\n");
        sb.append("| Direct interaction | ").append(report.direct() ? "✅ Yes" : "❌ No").append(" |\n");
        sb.append("| Shared neighbors | ").append(report.common().size()).append(" |\n");
        sb.append("| Neighbors ").append(report.subjectA()).append(" | ").append(report.neighborsA().size()).append(" |\n");
        sb.append("| Neighbors ").append(report.subjectB()).append(" | ").append(report.neighborsB().size()).append(" |\n\n");

        appendList(sb, "Shared neighbors", report.common());
        appendList(sb, "Neighbors of " + report.subjectA(), report.neighborsA());
        appendList(sb, "Neighbors of " + report.subjectB(), report.neighborsB());

        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }

    public void write(ContextBundle bundle, String caseId, Instant timestamp, Path path) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("# Context Bundle");
        if (caseId != null && !caseId.isBlank()) sb.append(" — ").append(caseId);
        sb.append("\n\n");
        sb.append("Erstellt: ").append(DISPLAY_FORMAT.format(timestamp)).append("\n\n");

        sb.append("| Abschnitt | Tokens | Gekürzt |\n|---|---|---|\n");
        for (BundleEntry e : bundle.entries()) {
            sb.append("| ").append(e.label())
                    .append(" | ").append(e.tokenCount())
                    .append(" | ").append(e.truncated() ? "✂" : "")
                    .append(" |\n");
        }
        sb.append(String.format("| **Gesamt** | **%d / %d** | %s |%n%n",
                bundle.totalTokens(), bundle.maxTokens(), bundle.truncated() ? "✂" : ""));

        for (BundleEntry e : bundle.entries()) {
            sb.append("## ").append(e.label()).append("\n\n");
            sb.append(e.content()).append("\n\n");
        }

        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }

    private void appendList(StringBuilder sb, String heading, Collection<String> items) {
        sb.append("## ").append(heading).append("\n\n");
        if (items.isEmpty()) {
            sb.append("_None_\n\n");
            return;
        }
        items.forEach(item -> sb.append("- ").append(item).append("\n"));
        sb.append("\n");
    }
}

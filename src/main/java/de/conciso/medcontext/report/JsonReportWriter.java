package de.conciso.medcontext.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.medcontext.model.BundleEntry;
import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.InteractionReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(InteractionReport report, Instant timestamp, Path path) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", timestamp.toString());
        json.put("subjectA", report.subjectA().name());
        json.put("subjectB", report.subjectB().name());
        json.put("direct", report.direct());
        json.put("common", List.copyOf(report.common()));
        json.put("neighborsA", List.copyOf(report.neighborsA()));
        json.put("neighborsB", List.copyOf(report.neighborsB()));

        objectMapper.writeValue(path.toFile(), json);
    }

    public void write(ContextBundle bundle, String caseId, Instant timestamp, Path path) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", timestamp.toString());
        json.put("caseId", caseId);

        Map<String, Object> budget = new LinkedHashMap<>();
        budget.put("maxTokens", bundle.maxTokens());
        budget.put("totalTokens", bundle.totalTokens());
        budget.put("truncated", bundle.truncated());
        json.put("budget", budget);

        json.put("sections", bundle.entries().stream().map(this::entryToMap).toList());

        objectMapper.writeValue(path.toFile(), json);
    }

    private Map<String, Object> entryToMap(BundleEntry entry) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("label", entry.label());
        m.put("tokens", entry.tokenCount());
        m.put("truncated", entry.truncated());
        m.put("content", entry.content());
        return m;
    }
}

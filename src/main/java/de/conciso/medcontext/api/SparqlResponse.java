package de.conciso.medcontext.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** SPARQL 1.1 Query Results JSON. */
@JsonIgnoreProperties(ignoreUnknown = true)
record SparqlResponse(Results results) {

    static final String MEDIA_TYPE = "application/sparql-results+json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Results(List<Map<String, Binding>> bindings) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Binding(String type, String value) {}

    /** Werte einer Variable über alle Zeilen; Zeilen ohne Bindung werden übersprungen. */
    List<String> values(String variable) {
        if (results == null || results.bindings() == null) return List.of();
        return results.bindings().stream()
                .map(row -> row.get(variable))
                .filter(Objects::nonNull)
                .map(Binding::value)
                .filter(Objects::nonNull)
                .toList();
    }
}

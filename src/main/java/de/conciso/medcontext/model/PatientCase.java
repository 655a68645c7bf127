package de.conciso.medcontext.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Eingabe für den Kontext-Modus, aus einer YAML-Datei geladen.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatientCase(
        String id,
        List<String> medications,
        @JsonProperty("prescribed_medicines") List<String> prescribedMedicines,
        @JsonProperty("current_disease") String currentDisease,
        Map<String, String> notes
) {
    public PatientCase {
        medications = withoutNulls(medications);
        prescribedMedicines = withoutNulls(prescribedMedicines);
        notes = notes == null ? Map.of() : notes;
    }

    // YAML "- ~" yields null items
    private static List<String> withoutNulls(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }
}

package de.conciso.medcontext.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ergebnis der Budget-Zuteilung: Abschnitte in Prioritätsreihenfolge,
 * Summe der Tokens nie größer als {@code maxTokens}.
 */
public record ContextBundle(
        List<BundleEntry> entries,
        int maxTokens,
        int totalTokens,
        /** true wenn mindestens ein Abschnitt gekürzt oder verworfen wurde. */
        boolean truncated
) {
    public ContextBundle {
        entries = List.copyOf(entries);
        if (totalTokens > maxTokens) {
            throw new IllegalStateException(
                    "Bundle exceeds budget: " + totalTokens + " > " + maxTokens);
        }
    }

    public Optional<BundleEntry> get(String label) {
        return entries.stream().filter(e -> e.label().equals(label)).findFirst();
    }

    public List<String> labels() {
        return entries.stream().map(BundleEntry::label).toList();
    }

    /** Label → Inhalt, in Bundle-Reihenfolge. */
    public Map<String, String> contents() {
        Map<String, String> contents = new LinkedHashMap<>();
        entries.forEach(e -> contents.put(e.label(), e.content()));
        return contents;
    }

    /** Alle Abschnitte als ein Text, wie er an ein Sprachmodell übergeben wird. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (BundleEntry e : entries) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(e.label()).append(":\n").append(e.content());
        }
        return sb.toString();
    }
}

package de.conciso.medcontext.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Vereinigung aller Adapter-Ergebnisse für ein Subjekt.
 * Die Namen sind sortiert, damit Reports unabhängig von der Abschlussreihenfolge der Adapter sind.
 */
public record NeighborSet(
        Subject subject,
        SortedSet<String> names,
        List<SourceResult> outcomes
) {
    public NeighborSet {
        names = Collections.unmodifiableSortedSet(new TreeSet<>(names));
        outcomes = List.copyOf(outcomes);
    }

    public static NeighborSet union(Subject subject, Collection<SourceResult> outcomes) {
        SortedSet<String> names = new TreeSet<>();
        for (SourceResult outcome : outcomes) {
            names.addAll(outcome.entities());
        }
        return new NeighborSet(subject, names, List.copyOf(outcomes));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public List<SourceResult> failures() {
        return outcomes.stream().filter(SourceResult::failed).toList();
    }
}

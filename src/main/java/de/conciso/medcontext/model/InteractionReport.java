package de.conciso.medcontext.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

public record InteractionReport(
        Subject subjectA,
        Subject subjectB,
        /** subjectB ∈ neighborsA oder subjectA ∈ neighborsB (asymmetrisch, ODER-verknüpft). */
        boolean direct,
        /** Schnittmenge beider Nachbarmengen. */
        SortedSet<String> common,
        SortedSet<String> neighborsA,
        SortedSet<String> neighborsB
) {
    public static InteractionReport of(NeighborSet a, NeighborSet b) {
        SortedSet<String> common = new TreeSet<>(a.names());
        common.retainAll(b.names());

        boolean direct = a.contains(b.subject().name()) || b.contains(a.subject().name());

        return new InteractionReport(
                a.subject(), b.subject(), direct,
                Collections.unmodifiableSortedSet(common),
                a.names(), b.names());
    }
}

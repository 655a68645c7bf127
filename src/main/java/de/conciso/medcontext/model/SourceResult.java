package de.conciso.medcontext.model;

import java.util.Set;

/**
 * Outcome of one adapter call. A failure always carries an empty entity set.
 */
public record SourceResult(
        String source,
        Set<String> entities,
        String failureReason
) {
    public SourceResult {
        entities = entities == null ? Set.of() : Set.copyOf(entities);
        if (failureReason != null && !entities.isEmpty()) {
            throw new IllegalArgumentException("A failed result cannot carry entities");
        }
    }

    public static SourceResult success(String source, Set<String> entities) {
        return new SourceResult(source, entities, null);
    }

    public static SourceResult failure(String source, String reason) {
        return new SourceResult(source, Set.of(), reason == null || reason.isBlank() ? "unknown" : reason);
    }

    public boolean failed() {
        return failureReason != null;
    }
}

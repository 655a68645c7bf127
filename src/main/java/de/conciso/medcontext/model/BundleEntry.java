package de.conciso.medcontext.model;

public record BundleEntry(
        String label,
        String content,
        int tokenCount,
        boolean truncated
) {}

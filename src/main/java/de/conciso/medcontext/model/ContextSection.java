package de.conciso.medcontext.model;

import java.util.Collection;

/**
 * Ein benannter Abschnitt gesammelten Texts. Kleinere Priorität = wichtiger.
 */
public record ContextSection(String label, SectionValue value, int priority) {

    public ContextSection {
        if (label == null || label.isBlank()) {
            throw new ValidationException("Section label must not be blank");
        }
        if (value == null) {
            throw new ValidationException("Section '" + label + "' has no value");
        }
    }

    public static ContextSection scalar(String label, String text, int priority) {
        return new ContextSection(label, new ScalarText(text), priority);
    }

    public static ContextSection list(String label, Collection<String> items, int priority) {
        return new ContextSection(label, TextList.of(items), priority);
    }

    public String serialize() {
        return value.serialize();
    }
}

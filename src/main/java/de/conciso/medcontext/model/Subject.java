package de.conciso.medcontext.model;

import java.util.regex.Pattern;

/**
 * Normalisierter Name eines Wirkstoffs oder einer Krankheit.
 * Trimmt und fasst Whitespace-Folgen zu einem Leerzeichen zusammen; Groß-/Kleinschreibung bleibt.
 */
public record Subject(String name) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Subject {
        name = normalize(name);
        if (name.isEmpty()) {
            throw new ValidationException("Subject name must not be empty");
        }
    }

    public static Subject of(String raw) {
        return new Subject(raw);
    }

    public static String normalize(String raw) {
        if (raw == null) {
            throw new ValidationException("Subject name must not be null");
        }
        return WHITESPACE.matcher(raw.trim()).replaceAll(" ");
    }

    @Override
    public String toString() {
        return name;
    }
}

package de.conciso.medcontext.api;

import de.conciso.medcontext.model.Subject;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Bringt quellspezifische Bezeichner in eine vergleichbare Form:
 * {@code http://dbpedia.org/resource/Acetylsalicylic_acid} → {@code Acetylsalicylic acid}.
 */
final class EntityNames {

    private EntityNames() {}

    static String normalize(String raw) {
        if (raw == null) return "";
        String value = raw.trim();
        if (value.startsWith("http://") || value.startsWith("https://")) {
            value = lastSegment(value);
        }
        return Subject.normalize(value.replace('_', ' '));
    }

    private static String lastSegment(String uri) {
        String path = uri;
        int hash = path.indexOf('#');
        if (hash >= 0) path = path.substring(0, hash);
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        String segment = path.substring(path.lastIndexOf('/') + 1);
        try {
            // '+' is literal in a path segment
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }
}

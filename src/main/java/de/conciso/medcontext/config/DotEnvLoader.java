package de.conciso.medcontext.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liest eine .env-Datei (KEY=VALUE, eine Zeile pro Eintrag) für Zugangsdaten.
 * Leerzeilen und Zeilen mit '#' werden ignoriert, umschließende Anführungszeichen entfernt.
 * Wird nur beim Start gelesen, nie während eines Quellenaufrufs.
 */
public class DotEnvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotEnvLoader.class);

    private final Path path;

    public DotEnvLoader(Path path) {
        this.path = path;
    }

    /**
     * Liefert eine leere Map wenn die Datei nicht existiert oder nicht lesbar ist.
     */
    public Map<String, String> load() {
        if (path == null || !Files.exists(path)) {
            log.debug(".env not found: {}", path);
            return Map.of();
        }

        Map<String, String> params = new LinkedHashMap<>();
        try {
            for (String line : Files.readAllLines(path)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                if (trimmed.startsWith("export ")) trimmed = trimmed.substring("export ".length()).trim();
                int eq = trimmed.indexOf('=');
                if (eq > 0) {
                    String key = trimmed.substring(0, eq).trim();
                    String value = unquote(trimmed.substring(eq + 1).trim());
                    params.put(key, value);
                }
            }
            log.info(".env loaded ({} entries): {}", params.size(), path);
        } catch (IOException e) {
            log.warn(".env could not be read: {}", path, e);
        }
        return params;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}

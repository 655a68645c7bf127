package de.conciso.medcontext.config;

import java.time.Duration;

/**
 * Endpunkte, Limits und Zugangsdaten aller Wissensquellen.
 * Wird einmal beim Start gebaut und validiert und den Adaptern im Konstruktor übergeben.
 */
public record KnowledgeSourceProperties(
        Duration timeout,
        String userAgent,
        Dbpedia dbpedia,
        Wikidata wikidata,
        GoogleKg googleKg,
        Arxiv arxiv,
        Wikipedia wikipedia
) {
    public KnowledgeSourceProperties {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("medcontext.sources.timeout-ms must be positive");
        }
        requireText(userAgent, "medcontext.sources.user-agent");
        if (dbpedia == null || wikidata == null || googleKg == null || arxiv == null || wikipedia == null) {
            throw new IllegalArgumentException("All knowledge source sections must be configured");
        }
    }

    public record Dbpedia(String url, String predicate, int limit) {
        public Dbpedia {
            requireText(url, "medcontext.sources.dbpedia.url");
            requireText(predicate, "medcontext.sources.dbpedia.predicate");
            requirePositive(limit, "medcontext.sources.dbpedia.limit");
        }
    }

    public record Wikidata(String apiUrl, String sparqlUrl, String language) {
        public Wikidata {
            requireText(apiUrl, "medcontext.sources.wikidata.api-url");
            requireText(sparqlUrl, "medcontext.sources.wikidata.sparql-url");
            requireText(language, "medcontext.sources.wikidata.language");
        }
    }

    public record GoogleKg(String url, String apiKey, int limit) {
        public GoogleKg {
            requireText(url, "medcontext.sources.google-kg.url");
            requirePositive(limit, "medcontext.sources.google-kg.limit");
            apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public boolean hasApiKey() {
            return !apiKey.isEmpty();
        }

        @Override
        public String toString() {
            return "GoogleKg[url=" + url + ", apiKey=" + (hasApiKey() ? "***" : "(none)") + ", limit=" + limit + "]";
        }
    }

    public record Arxiv(String url, int maxResults) {
        public Arxiv {
            requireText(url, "medcontext.sources.arxiv.url");
            requirePositive(maxResults, "medcontext.sources.arxiv.max-results");
        }
    }

    public record Wikipedia(String url) {
        public Wikipedia {
            requireText(url, "medcontext.sources.wikipedia.url");
        }
    }

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be blank");
        }
    }

    private static void requirePositive(int value, String property) {
        if (value <= 0) {
            throw new IllegalArgumentException(property + " must be > 0, was " + value);
        }
    }
}

package de.conciso.medcontext.api;

import de.conciso.medcontext.config.KnowledgeSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Verwandte Wirkstoffe aus DBpedia ({@code dbo:relatedDrug}, konfigurierbar) per SPARQL.
 */
@Component
public class DbpediaSource extends AbstractKnowledgeSource {

    static final String NAME = "DBpedia";
    static final String RESOURCE_PREFIX = "http://dbpedia.org/resource/";

    // Characters that are not allowed inside a SPARQL IRIREF
    private static final Pattern IRI_UNSAFE = Pattern.compile("[<>\"{}|^`\\\\]");

    private final RestClient restClient;
    private final KnowledgeSourceProperties.Dbpedia config;

    public DbpediaSource(RestClient.Builder restClientBuilder, KnowledgeSourceProperties properties) {
        this.config = properties.dbpedia();
        this.restClient = restClientBuilder.baseUrl(config.url()).build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<String> query(Subject subject) {
        if (IRI_UNSAFE.matcher(subject.name()).find()) {
            throw new SourceUnavailableException("subject contains characters not allowed in an IRI");
        }
        String sparql = buildQuery(subject);
        log.debug("DBpedia query:\n{}", sparql);

        SparqlResponse response = restClient.get()
                .uri(b -> b.queryParam("query", "{query}")
                        .queryParam("format", "{format}")
                        .build(sparql, "json"))
                .accept(MediaType.parseMediaType(SparqlResponse.MEDIA_TYPE), MediaType.APPLICATION_JSON)
                .retrieve()
                .body(SparqlResponse.class);

        if (response == null) {
            log.warn("Empty DBpedia response for: {}", subject);
            return List.of();
        }
        return response.values("related");
    }

    String buildQuery(Subject subject) {
        return String.join("\n",
                "PREFIX dbo: <http://dbpedia.org/ontology/>",
                "SELECT ?related WHERE {",
                "    <" + resourceIri(subject) + "> " + config.predicate() + " ?related .",
                "} LIMIT " + config.limit());
    }

    static String resourceIri(Subject subject) {
        return RESOURCE_PREFIX + subject.name().replace(' ', '_');
    }
}

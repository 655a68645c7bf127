package de.conciso.medcontext.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.medcontext.config.KnowledgeSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Wechselwirkungen aus Wikidata ({@code wdt:P769}, "significant drug interaction").
 * Der Name wird zuerst über {@code wbsearchentities} in eine Entity-ID aufgelöst.
 */
@Component
public class WikidataSource extends AbstractKnowledgeSource {

    static final String NAME = "Wikidata";

    private static final Pattern ENTITY_ID = Pattern.compile("Q\\d+");

    private final RestClient restClient;
    private final KnowledgeSourceProperties.Wikidata config;

    public WikidataSource(RestClient.Builder restClientBuilder, KnowledgeSourceProperties properties) {
        this.config = properties.wikidata();
        this.restClient = restClientBuilder.build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<String> query(Subject subject) {
        Optional<String> entityId = resolveEntityId(subject);
        if (entityId.isEmpty()) {
            log.debug("No Wikidata entity for: {}", subject);
            return List.of();
        }

        String sparql = buildQuery(entityId.get());
        log.debug("Wikidata query:\n{}", sparql);

        SparqlResponse response = restClient.get()
                .uri(config.sparqlUrl() + "?query={query}&format={format}", sparql, "json")
                .accept(MediaType.parseMediaType(SparqlResponse.MEDIA_TYPE), MediaType.APPLICATION_JSON)
                .retrieve()
                .body(SparqlResponse.class);

        if (response == null) {
            log.warn("Empty Wikidata response for: {} ({})", subject, entityId.get());
            return List.of();
        }
        return response.values("interactionLabel");
    }

    Optional<String> resolveEntityId(Subject subject) {
        SearchResponse response = restClient.get()
                .uri(config.apiUrl()
                                + "?action=wbsearchentities&search={search}&language={language}"
                                + "&type=item&limit=1&format=json",
                        subject.name(), config.language())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(SearchResponse.class);

        if (response == null || response.search() == null || response.search().isEmpty()) {
            return Optional.empty();
        }
        String id = response.search().get(0).id();
        if (id == null || !ENTITY_ID.matcher(id).matches()) {
            throw new SourceUnavailableException("unexpected entity id: " + id);
        }
        return Optional.of(id);
    }

    String buildQuery(String entityId) {
        return String.join("\n",
                "SELECT ?interactionLabel WHERE {",
                "    wd:" + entityId + " wdt:P769 ?interaction .",
                "    SERVICE wikibase:label { bd:serviceParam wikibase:language \"" + config.language() + "\". }",
                "}");
    }

    // --- wbsearchentities response records ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<SearchHit> search) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchHit(String id, String label) {}
}

package de.conciso.medcontext.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.medcontext.config.KnowledgeSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Objects;

/**
 * Entitäten aus der Google Knowledge Graph Search API. Ohne API-Key wird keine Anfrage gestellt.
 */
@Component
public class GoogleKnowledgeGraphSource extends AbstractKnowledgeSource {

    static final String NAME = "GoogleKG";

    private final RestClient restClient;
    private final KnowledgeSourceProperties.GoogleKg config;

    public GoogleKnowledgeGraphSource(RestClient.Builder restClientBuilder, KnowledgeSourceProperties properties) {
        this.config = properties.googleKg();
        this.restClient = restClientBuilder.baseUrl(config.url()).build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<String> query(Subject subject) {
        if (!config.hasApiKey()) {
            throw new SourceUnavailableException("missing credential");
        }

        SearchResponse response = restClient.get()
                .uri(b -> b.queryParam("query", "{query}")
                        .queryParam("key", "{key}")
                        .queryParam("limit", config.limit())
                        .queryParam("languages", "en")
                        .build(subject.name(), config.apiKey()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(SearchResponse.class);

        if (response == null || response.itemListElement() == null) {
            log.warn("Empty Knowledge Graph response for: {}", subject);
            return List.of();
        }

        // Items without a name are skipped
        return response.itemListElement().stream()
                .map(Item::result)
                .filter(Objects::nonNull)
                .map(EntityResult::name)
                .filter(Objects::nonNull)
                .toList();
    }

    // --- entities:search response records ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Item> itemListElement) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Item(EntityResult result) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntityResult(String name) {}
}

package de.conciso.medcontext.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.medcontext.config.KnowledgeSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Kurzbeschreibung eines Subjekts aus der Wikipedia REST-API ({@code /page/summary/{title}}).
 */
@Component
public class WikipediaClient {

    private static final Logger log = LoggerFactory.getLogger(WikipediaClient.class);

    private final RestClient restClient;

    public WikipediaClient(RestClient.Builder restClientBuilder, KnowledgeSourceProperties properties) {
        this.restClient = restClientBuilder.baseUrl(properties.wikipedia().url()).build();
    }

    /**
     * Leer wenn es keine Seite gibt; andere HTTP-Fehler werden weitergereicht.
     */
    public Optional<String> summary(Subject subject) {
        PageSummary page;
        try {
            page = restClient.get()
                    .uri("/{title}", subject.name().replace(' ', '_'))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(PageSummary.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No Wikipedia page for: {}", subject);
            return Optional.empty();
        }

        if (page == null || page.extract() == null || page.extract().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(page.extract().trim());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PageSummary(String title, String extract) {}
}

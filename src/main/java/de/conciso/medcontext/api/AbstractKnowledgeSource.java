package de.conciso.medcontext.api;

import de.conciso.medcontext.model.SourceResult;
import de.conciso.medcontext.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gemeinsamer Rahmen der Adapter: Quelle abfragen, Namen normalisieren,
 * jeden Fehler in ein {@link SourceResult#failure} übersetzen.
 */
public abstract class AbstractKnowledgeSource implements KnowledgeSource {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Rohe Namen der verwandten Entitäten (URIs, Labels ...). */
    protected abstract Collection<String> query(Subject subject);

    @Override
    public final SourceResult fetch(Subject subject) {
        try {
            Collection<String> raw = query(subject);
            Set<String> names = new LinkedHashSet<>();
            for (String value : raw) {
                String name = EntityNames.normalize(value);
                if (!name.isEmpty()) names.add(name);
            }
            log.debug("[{}] {} → {}", name(), subject, names);
            return SourceResult.success(name(), names);
        } catch (SourceUnavailableException e) {
            log.warn("[{}] skipped for '{}': {}", name(), subject, e.getMessage());
            return SourceResult.failure(name(), e.getMessage());
        } catch (RestClientException e) {
            log.warn("[{}] request failed for '{}': {}", name(), subject, e.getMessage());
            return SourceResult.failure(name(), "request failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[{}] unexpected response for '{}'", name(), subject, e);
            return SourceResult.failure(name(), "malformed response: " + e);
        }
    }
}

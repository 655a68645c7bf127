package de.conciso.medcontext.config;

import de.conciso.medcontext.token.JtokkitTokenizer;
import de.conciso.medcontext.token.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class KnowledgeSourceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeSourceConfiguration.class);

    // Keys accepted in .env, in order of precedence
    static final List<String> GOOGLE_KG_KEY_NAMES = List.of("GOOGLE_KG_API_KEY", "gkg_api");

    @Bean
    public KnowledgeSourceProperties knowledgeSourceProperties(
            @Value("${medcontext.sources.timeout-ms:10000}") long timeoutMs,
            @Value("${medcontext.sources.user-agent}") String userAgent,
            @Value("${medcontext.sources.dbpedia.url}") String dbpediaUrl,
            @Value("${medcontext.sources.dbpedia.predicate:dbo:relatedDrug}") String dbpediaPredicate,
            @Value("${medcontext.sources.dbpedia.limit:10}") int dbpediaLimit,
            @Value("${medcontext.sources.wikidata.api-url}") String wikidataApiUrl,
            @Value("${medcontext.sources.wikidata.sparql-url}") String wikidataSparqlUrl,
            @Value("${medcontext.sources.wikidata.language:en}") String wikidataLanguage,
            @Value("${medcontext.sources.google-kg.url}") String googleKgUrl,
            @Value("${medcontext.sources.google-kg.api-key:}") String googleKgApiKey,
            @Value("${medcontext.sources.google-kg.limit:10}") int googleKgLimit,
            @Value("${medcontext.sources.arxiv.url}") String arxivUrl,
            @Value("${medcontext.sources.arxiv.max-results:5}") int arxivMaxResults,
            @Value("${medcontext.sources.wikipedia.url}") String wikipediaUrl,
            @Value("${medcontext.dotenv.path:.env}") String dotEnvPath
    ) {
        String apiKey = resolveGoogleKgKey(googleKgApiKey, new DotEnvLoader(Path.of(dotEnvPath)).load());

        KnowledgeSourceProperties properties = new KnowledgeSourceProperties(
                Duration.ofMillis(timeoutMs),
                userAgent,
                new KnowledgeSourceProperties.Dbpedia(dbpediaUrl, dbpediaPredicate, dbpediaLimit),
                new KnowledgeSourceProperties.Wikidata(wikidataApiUrl, wikidataSparqlUrl, wikidataLanguage),
                new KnowledgeSourceProperties.GoogleKg(googleKgUrl, apiKey, googleKgLimit),
                new KnowledgeSourceProperties.Arxiv(arxivUrl, arxivMaxResults),
                new KnowledgeSourceProperties.Wikipedia(wikipediaUrl));

        if (!properties.googleKg().hasApiKey()) {
            log.warn("No Google Knowledge Graph API key configured, that source will report failures");
        }
        log.info("Knowledge sources configured: {}", properties);
        return properties;
    }

    static String resolveGoogleKgKey(String configured, Map<String, String> dotEnv) {
        if (configured != null && !configured.isBlank()) return configured;
        return GOOGLE_KG_KEY_NAMES.stream()
                .map(dotEnv::get)
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse("");
    }

    @Bean
    public RestClientCustomizer knowledgeSourceTimeouts(KnowledgeSourceProperties properties) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout((int) properties.timeout().toMillis());
            factory.setReadTimeout((int) properties.timeout().toMillis());
            builder.requestFactory(factory)
                    .defaultHeader("User-Agent", properties.userAgent());
        };
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sourceExecutor(@Value("${medcontext.sources.pool-size:8}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "source-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Tokenizer tokenizer(@Value("${medcontext.context.encoding:cl100k_base}") String encodingName) {
        JtokkitTokenizer tokenizer = new JtokkitTokenizer(encodingName);
        log.info("Tokenizer: {}", tokenizer.encodingName());
        return tokenizer;
    }
}

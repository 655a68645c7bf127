package de.conciso.medcontext.config;

import java.time.Duration;

/** Properties with the public endpoints, as configured in application.yml. */
public final class TestSourceProperties {

    public static final String DBPEDIA_URL = "https://dbpedia.org/sparql";
    public static final String WIKIDATA_API_URL = "https://www.wikidata.org/w/api.php";
    public static final String WIKIDATA_SPARQL_URL = "https://query.wikidata.org/sparql";
    public static final String GOOGLE_KG_URL = "https://kgsearch.googleapis.com/v1/entities:search";
    public static final String ARXIV_URL = "http://export.arxiv.org/api/query";
    public static final String WIKIPEDIA_URL = "https://en.wikipedia.org/api/rest_v1/page/summary";

    private TestSourceProperties() {}

    public static KnowledgeSourceProperties create(String googleKgApiKey) {
        return new KnowledgeSourceProperties(
                Duration.ofSeconds(2),
                "MedContext-Test",
                new KnowledgeSourceProperties.Dbpedia(DBPEDIA_URL, "dbo:relatedDrug", 10),
                new KnowledgeSourceProperties.Wikidata(WIKIDATA_API_URL, WIKIDATA_SPARQL_URL, "en"),
                new KnowledgeSourceProperties.GoogleKg(GOOGLE_KG_URL, googleKgApiKey, 10),
                new KnowledgeSourceProperties.Arxiv(ARXIV_URL, 5),
                new KnowledgeSourceProperties.Wikipedia(WIKIPEDIA_URL));
    }
}

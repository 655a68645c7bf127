package de.conciso.medcontext.api;

import de.conciso.medcontext.config.KnowledgeSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Fachartikel zu einem Subjekt über die arXiv-API (Atom-Feed).
 */
@Component
public class ArxivClient {

    private static final Logger log = LoggerFactory.getLogger(ArxivClient.class);

    static final String ATOM_NS = "http://www.w3.org/2005/Atom";

    private final RestClient restClient;
    private final int maxResults;

    public ArxivClient(RestClient.Builder restClientBuilder, KnowledgeSourceProperties properties) {
        this.restClient = restClientBuilder.baseUrl(properties.arxiv().url()).build();
        this.maxResults = properties.arxiv().maxResults();
    }

    public List<Article> search(Subject subject) {
        String raw = restClient.get()
                .uri(b -> b.queryParam("search_query", "{query}")
                        .queryParam("start", 0)
                        .queryParam("max_results", maxResults)
                        .build(subject.name()))
                .accept(MediaType.APPLICATION_ATOM_XML, MediaType.APPLICATION_XML)
                .retrieve()
                .body(String.class);

        if (raw == null || raw.isBlank()) {
            log.warn("Empty arXiv response for: {}", subject);
            return List.of();
        }
        List<Article> articles = parse(raw);
        log.debug("arXiv articles for {}: {}", subject, articles.size());
        return articles;
    }

    public record Article(String title, String summary) {

        /** Eine Zeile im Kontext: "Titel: Zusammenfassung". */
        public String render() {
            return summary.isEmpty() ? title : title + ": " + summary;
        }
    }

    // --- helpers ---

    static List<Article> parse(String atom) {
        Document document = readXml(atom);
        NodeList entries = document.getElementsByTagNameNS(ATOM_NS, "entry");
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String title = childText(entry, "title");
            if (title.isEmpty()) continue;
            articles.add(new Article(title, childText(entry, "summary")));
        }
        return List.copyOf(articles);
    }

    private static Document readXml(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalStateException("Malformed arXiv feed", e);
        }
    }

    private static String childText(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(ATOM_NS, localName);
        if (nodes.getLength() == 0) return "";
        return Subject.normalize(nodes.item(0).getTextContent());
    }
}

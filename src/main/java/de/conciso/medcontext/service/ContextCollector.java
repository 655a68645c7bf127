package de.conciso.medcontext.service;

import de.conciso.medcontext.api.ArxivClient;
import de.conciso.medcontext.api.KnowledgeSource;
import de.conciso.medcontext.api.WikipediaClient;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.NeighborSet;
import de.conciso.medcontext.model.PatientCase;
import de.conciso.medcontext.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sammelt Kontext-Abschnitte zu Wirkstoffen und Krankheiten: Kurzbeschreibung (Wikipedia),
 * Wechselwirkungen (alle Wissensquellen) und Fachartikel (arXiv).
 * Eine ausgefallene Textquelle lässt nur ihren Abschnitt weg.
 */
@Service
public class ContextCollector {

    private static final Logger log = LoggerFactory.getLogger(ContextCollector.class);

    public static final int PRIORITY_CASE = 0;
    public static final int PRIORITY_NOTES = 1;
    public static final int PRIORITY_SUMMARY = 10;
    public static final int PRIORITY_INTERACTIONS = 20;
    public static final int PRIORITY_ARTICLES = 30;

    static final String LABEL_SEPARATOR = " · ";

    private final InteractionGraphBuilder graphBuilder;
    private final List<KnowledgeSource> sources;
    private final WikipediaClient wikipediaClient;
    private final ArxivClient arxivClient;

    public ContextCollector(InteractionGraphBuilder graphBuilder,
                            List<KnowledgeSource> sources,
                            WikipediaClient wikipediaClient,
                            ArxivClient arxivClient) {
        this.graphBuilder = graphBuilder;
        this.sources = List.copyOf(sources);
        this.wikipediaClient = wikipediaClient;
        this.arxivClient = arxivClient;
    }

    public List<ContextSection> collect(PatientCase patientCase) {
        List<ContextSection> sections = new ArrayList<>();
        sections.add(ContextSection.scalar("Case", overview(patientCase), PRIORITY_CASE));
        for (Map.Entry<String, String> note : patientCase.notes().entrySet()) {
            if (note.getValue() == null || note.getValue().isBlank()) continue;
            sections.add(ContextSection.scalar("Notes" + LABEL_SEPARATOR + note.getKey(), note.getValue().trim(), PRIORITY_NOTES));
        }

        Set<Subject> subjects = subjectsOf(patientCase);
        log.info("Collecting context for {} subject(s): {}", subjects.size(), subjects);
        for (Subject subject : subjects) {
            sections.addAll(collect(subject));
        }
        return withUniqueLabels(sections);
    }

    public List<ContextSection> collect(Subject subject) {
        List<ContextSection> sections = new ArrayList<>();

        summary(subject).ifPresent(text ->
                sections.add(ContextSection.scalar(label(subject, "Summary"), text, PRIORITY_SUMMARY)));

        NeighborSet neighbors = graphBuilder.aggregate(subject, sources);
        if (!neighbors.isEmpty()) {
            sections.add(ContextSection.list(label(subject, "Interactions"), neighbors.names(), PRIORITY_INTERACTIONS));
        }

        List<String> articles = articles(subject);
        if (!articles.isEmpty()) {
            sections.add(ContextSection.list(label(subject, "Articles"), articles, PRIORITY_ARTICLES));
        }

        log.debug("{}: {} section(s)", subject, sections.size());
        return sections;
    }

    static String label(Subject subject, String kind) {
        return subject.name() + LABEL_SEPARATOR + kind;
    }

    /** Medikamente, verordnete Medikamente und Krankheit; kommagetrennte Einträge werden aufgeteilt. */
    static Set<Subject> subjectsOf(PatientCase patientCase) {
        Set<Subject> subjects = new LinkedHashSet<>();
        addAll(subjects, patientCase.medications());
        addAll(subjects, patientCase.prescribedMedicines());
        if (patientCase.currentDisease() != null) {
            addAll(subjects, List.of(patientCase.currentDisease()));
        }
        return subjects;
    }

    // --- helpers ---

    private Optional<String> summary(Subject subject) {
        try {
            return wikipediaClient.summary(subject);
        } catch (RuntimeException e) {
            log.warn("Wikipedia summary failed for '{}': {}", subject, e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> articles(Subject subject) {
        try {
            return arxivClient.search(subject).stream().map(ArxivClient.Article::render).toList();
        } catch (RuntimeException e) {
            log.warn("arXiv search failed for '{}': {}", subject, e.getMessage());
            return List.of();
        }
    }

    private static String overview(PatientCase patientCase) {
        List<String> lines = new ArrayList<>();
        if (patientCase.id() != null && !patientCase.id().isBlank()) {
            lines.add("Case: " + patientCase.id());
        }
        lines.add("Current disease: " + orNone(patientCase.currentDisease()));
        lines.add("Medications: " + joinOrNone(patientCase.medications()));
        lines.add("Prescribed medicines: " + joinOrNone(patientCase.prescribedMedicines()));
        return String.join("\n", lines);
    }

    private static void addAll(Set<Subject> subjects, Collection<String> entries) {
        for (String entry : entries) {
            for (String part : entry.split(",")) {
                if (!part.isBlank()) subjects.add(Subject.of(part));
            }
        }
    }

    /** Note keys can spell out a subject label ("Notes · Summary"); later duplicates get a counter. */
    static List<ContextSection> withUniqueLabels(List<ContextSection> sections) {
        Set<String> seen = new HashSet<>();
        List<ContextSection> unique = new ArrayList<>(sections.size());
        for (ContextSection section : sections) {
            String label = section.label();
            for (int i = 2; !seen.add(label); i++) {
                label = section.label() + " (" + i + ")";
            }
            if (!label.equals(section.label())) {
                log.debug("Section label '{}' already taken, using '{}'", section.label(), label);
                unique.add(new ContextSection(label, section.value(), section.priority()));
            } else {
                unique.add(section);
            }
        }
        return unique;
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "(none)" : value.trim();
    }

    private static String joinOrNone(List<String> values) {
        return values.isEmpty() ? "(none)" : String.join(", ", values);
    }
}

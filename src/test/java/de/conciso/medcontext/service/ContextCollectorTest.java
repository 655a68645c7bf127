package de.conciso.medcontext.service;

import de.conciso.medcontext.api.ArxivClient;
import de.conciso.medcontext.api.WikipediaClient;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.NeighborSet;
import de.conciso.medcontext.model.PatientCase;
import de.conciso.medcontext.model.SourceResult;
import de.conciso.medcontext.model.Subject;
import de.conciso.medcontext.model.TextList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextCollectorTest {

    @Mock
    private InteractionGraphBuilder graphBuilder;

    @Mock
    private WikipediaClient wikipediaClient;

    @Mock
    private ArxivClient arxivClient;

    private ContextCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ContextCollector(graphBuilder, List.of(), wikipediaClient, arxivClient);
        lenient().when(graphBuilder.aggregate(any(Subject.class), anyList()))
                .thenAnswer(inv -> NeighborSet.union(inv.getArgument(0), List.of()));
    }

    @Test
    void collectsSummaryInteractionsAndArticlesForSubject() {
        Subject warfarin = Subject.of("Warfarin");
        when(wikipediaClient.summary(warfarin)).thenReturn(Optional.of("Warfarin is an anticoagulant."));
        when(graphBuilder.aggregate(eq(warfarin), anyList())).thenReturn(NeighborSet.union(warfarin,
                List.of(SourceResult.success("DBpedia", Set.of("Heparin", "Aspirin")))));
        when(arxivClient.search(warfarin)).thenReturn(List.of(
                new ArxivClient.Article("Dosing warfarin", "A study."),
                new ArxivClient.Article("Untitled abstract", "")));

        List<ContextSection> sections = collector.collect(warfarin);

        assertThat(sections).extracting(ContextSection::label)
                .containsExactly("Warfarin · Summary", "Warfarin · Interactions", "Warfarin · Articles");
        assertThat(sections).extracting(ContextSection::priority)
                .containsExactly(ContextCollector.PRIORITY_SUMMARY,
                        ContextCollector.PRIORITY_INTERACTIONS,
                        ContextCollector.PRIORITY_ARTICLES);
        assertThat(sections.get(1).value()).isEqualTo(new TextList(List.of("Aspirin", "Heparin")));
        assertThat(sections.get(2).serialize()).isEqualTo("Dosing warfarin: A study.\nUntitled abstract");
    }

    @Test
    void failingTextSourcesOnlyDropTheirSections() {
        Subject aspirin = Subject.of("Aspirin");
        when(wikipediaClient.summary(aspirin)).thenThrow(new ResourceAccessException("connect timed out"));
        when(arxivClient.search(aspirin)).thenThrow(new IllegalStateException("Malformed arXiv feed"));

        List<ContextSection> sections = collector.collect(aspirin);

        assertThat(sections).isEmpty();
    }

    @Test
    void caseContributesOverviewNotesAndEachSubjectOnce() {
        when(wikipediaClient.summary(any())).thenReturn(Optional.empty());
        when(arxivClient.search(any())).thenReturn(List.of());
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("Allergies", "Penicillin");
        notes.put("Tests", " ");
        PatientCase patientCase = new PatientCase("c-1",
                List.of("Warfarin"), List.of("Aspirin, Warfarin"), "Atrial fibrillation", notes);

        List<ContextSection> sections = collector.collect(patientCase);

        assertThat(sections).extracting(ContextSection::label).containsExactly("Case", "Notes · Allergies");
        assertThat(sections.get(0).serialize())
                .contains("Case: c-1")
                .contains("Current disease: Atrial fibrillation")
                .contains("Prescribed medicines: Aspirin, Warfarin");
        verify(wikipediaClient, times(3)).summary(any());
    }

    @Test
    void subjectsAreSplitOnCommasAndDeduplicated() {
        PatientCase patientCase = new PatientCase(null,
                List.of("Warfarin , Aspirin", " "), List.of("Aspirin"), "Gout", null);

        assertThat(ContextCollector.subjectsOf(patientCase))
                .containsExactly(Subject.of("Warfarin"), Subject.of("Aspirin"), Subject.of("Gout"));
    }

    @Test
    void noteKeysThatMatchSubjectLabelsStillGiveUniqueLabels() {
        Subject notes = Subject.of("Notes");
        when(wikipediaClient.summary(notes)).thenReturn(Optional.of("A notes summary."));
        when(arxivClient.search(notes)).thenReturn(List.of());
        PatientCase patientCase = new PatientCase("c-2",
                List.of("Notes"), List.of(), null, Map.of("Summary", "Patient reports dizziness."));

        List<ContextSection> sections = collector.collect(patientCase);

        assertThat(sections).extracting(ContextSection::label)
                .containsExactly("Case", "Notes · Summary", "Notes · Summary (2)");
        assertThat(sections.get(1).serialize()).isEqualTo("Patient reports dizziness.");
        assertThat(sections.get(2).serialize()).isEqualTo("A notes summary.");
        assertThat(new TokenBudgetAllocator().assemble(sections, 100, new WordTokenizer()).labels())
                .hasSize(3);
    }

    @Test
    void repeatedCollisionsCountUp() {
        List<ContextSection> sections = ContextCollector.withUniqueLabels(List.of(
                ContextSection.scalar("A", "1", 0),
                ContextSection.scalar("A", "2", 0),
                ContextSection.scalar("A (2)", "3", 0)));

        assertThat(sections).extracting(ContextSection::label).containsExactly("A", "A (2)", "A (2) (2)");
    }
}

package de.conciso.medcontext.service;

import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.InteractionReport;
import de.conciso.medcontext.model.PatientCase;
import de.conciso.medcontext.model.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MedContextServiceTest {

    private ExecutorService executor;
    private ContextCollector collector;
    private MedContextService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        collector = mock(ContextCollector.class);
        service = new MedContextService(
                new InteractionGraphBuilder(executor, 1000),
                new TokenBudgetAllocator(),
                collector,
                List.of(StubSource.returning("A", "Aspirin", "Heparin"),
                        StubSource.returning("B", "Heparin")),
                new WordTokenizer());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void buildsReportWithConfiguredSources() {
        InteractionReport report = service.buildInteractionReport("Warfarin", "Aspirin");

        assertThat(report.direct()).isTrue();
        assertThat(report.common()).containsExactly("Aspirin", "Heparin");
    }

    @Test
    void explicitAdaptersReplaceConfiguredOnes() {
        InteractionReport report = service.buildInteractionReport("Warfarin", "Aspirin",
                List.of(StubSource.returning("C", "Vitamin K")));

        assertThat(report.direct()).isFalse();
        assertThat(report.common()).containsExactly("Vitamin K");
    }

    @Test
    void blankSubjectIsRejected() {
        assertThatThrownBy(() -> service.buildInteractionReport(" ", "Aspirin"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void assemblesWithConfiguredTokenizer() {
        List<ContextSection> sections = List.of(
                ContextSection.scalar("Summary", WordTokenizer.words("s", 4), 10),
                ContextSection.scalar("Articles", WordTokenizer.words("a", 4), 30));

        ContextBundle bundle = service.assembleContext(sections, 6);

        assertThat(bundle.totalTokens()).isEqualTo(6);
        assertThat(bundle.get("Articles")).hasValueSatisfying(e -> assertThat(e.tokenCount()).isEqualTo(2));
    }

    @Test
    void delegatesCollection() {
        PatientCase patientCase = new PatientCase("c1", List.of("Warfarin"), List.of(), "", null);
        List<ContextSection> sections = List.of(ContextSection.scalar("Case", "Warfarin", 0));
        when(collector.collect(patientCase)).thenReturn(sections);

        assertThat(service.collectContext(patientCase)).isSameAs(sections);
    }

    @Test
    void listsSourceNames() {
        assertThat(service.sourceNames()).containsExactly("A", "B");
    }
}

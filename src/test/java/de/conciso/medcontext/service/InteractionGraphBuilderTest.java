package de.conciso.medcontext.service;

import de.conciso.medcontext.api.KnowledgeSource;
import de.conciso.medcontext.model.InteractionReport;
import de.conciso.medcontext.model.NeighborSet;
import de.conciso.medcontext.model.SourceResult;
import de.conciso.medcontext.model.Subject;
import de.conciso.medcontext.model.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class InteractionGraphBuilderTest {

    private ExecutorService executor;
    private InteractionGraphBuilder builder;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        builder = new InteractionGraphBuilder(executor, 300);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void unionsResultsOfAllSources() {
        List<KnowledgeSource> sources = List.of(
                StubSource.returning("A", "x", "y"),
                StubSource.returning("B"),
                StubSource.returning("C", "y", "z"));

        NeighborSet neighbors = builder.aggregate(Subject.of("foo"), sources);

        assertThat(neighbors.names()).containsExactly("x", "y", "z");
        assertThat(neighbors.failures()).isEmpty();
    }

    @Test
    void allSourcesEmptyIsValidEmptyResult() {
        NeighborSet neighbors = builder.aggregate(Subject.of("foo"),
                List.of(StubSource.returning("A"), StubSource.returning("B")));

        assertThat(neighbors.isEmpty()).isTrue();
    }

    @Test
    void noSourcesGiveEmptyResult() {
        assertThat(builder.aggregate(Subject.of("foo"), List.of()).isEmpty()).isTrue();
    }

    @Test
    void resultDoesNotDependOnSourceOrder() {
        List<KnowledgeSource> sources = new ArrayList<>(List.of(
                StubSource.returning("A", "x", "y"),
                StubSource.returning("B", "q"),
                StubSource.returning("C", "y", "z"),
                StubSource.returning("D", "a", "x")));
        Set<String> expected = builder.aggregate(Subject.of("foo"), sources).names();

        Random random = new Random(42);
        for (int i = 0; i < 5; i++) {
            Collections.shuffle(sources, random);
            assertThat(builder.aggregate(Subject.of("foo"), sources).names()).isEqualTo(expected);
        }
    }

    @Test
    void throwingSourceIsIsolated() {
        NeighborSet neighbors = builder.aggregate(Subject.of("foo"), List.of(
                StubSource.returning("A", "x"),
                StubSource.throwing("B"),
                StubSource.returning("C", "z")));

        assertThat(neighbors.names()).containsExactly("x", "z");
        assertThat(neighbors.failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.source()).isEqualTo("B");
                    assertThat(f.failureReason()).contains("source B is down");
                });
    }

    @Test
    void slowSourceTimesOutWithoutBlockingSiblings() {
        NeighborSet neighbors = builder.aggregate(Subject.of("foo"), List.of(
                StubSource.returning("A", "x"),
                StubSource.sleeping("Slow", 5_000)));

        assertThat(neighbors.names()).containsExactly("x");
        assertThat(neighbors.failures()).singleElement()
                .satisfies(f -> assertThat(f.failureReason()).isEqualTo("timeout"));
    }

    @Test
    void nullResultCountsAsFailure() {
        NeighborSet neighbors = builder.aggregate(Subject.of("foo"),
                List.of(new StubSource("Null", s -> null)));

        assertThat(neighbors.isEmpty()).isTrue();
        assertThat(neighbors.failures()).hasSize(1);
    }

    @Test
    void buildsReportForTwoSubjects() {
        Map<String, Set<String>> graph = Map.of(
                "Warfarin", Set.of("Aspirin", "Vitamin K"),
                "Ibuprofen", Set.of("Aspirin", "Naproxen", "Warfarin"));
        KnowledgeSource source = new StubSource("Graph",
                s -> SourceResult.success("Graph", graph.getOrDefault(s.name(), Set.of())));

        InteractionReport report = builder.buildReport("Warfarin", " Ibuprofen ", List.of(source));

        assertThat(report.subjectB().name()).isEqualTo("Ibuprofen");
        assertThat(report.common()).containsExactly("Aspirin");
        assertThat(report.direct()).isTrue();
        assertThat(report.neighborsA()).containsExactly("Aspirin", "Vitamin K");
    }

    @Test
    void invalidSubjectFailsBeforeAnySourceIsCalled() {
        KnowledgeSource source = mock(KnowledgeSource.class);

        assertThatThrownBy(() -> builder.buildReport("Warfarin", "  ", List.of(source)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> builder.buildReport(null, "Aspirin", List.of(source)))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(source);
    }

    @Test
    void nullSourceListIsRejected() {
        assertThatThrownBy(() -> builder.aggregate(Subject.of("foo"), null))
                .isInstanceOf(ValidationException.class);
    }
}

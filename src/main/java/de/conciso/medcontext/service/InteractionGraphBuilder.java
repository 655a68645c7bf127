package de.conciso.medcontext.service;

import de.conciso.medcontext.api.KnowledgeSource;
import de.conciso.medcontext.model.InteractionReport;
import de.conciso.medcontext.model.NeighborSet;
import de.conciso.medcontext.model.SourceResult;
import de.conciso.medcontext.model.Subject;
import de.conciso.medcontext.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fragt alle Quellen parallel ab, vereinigt deren Ergebnisse zu einer Nachbarmenge
 * und leitet daraus den paarweisen Interaktionsreport ab.
 *
 * <p>Jeder Quellenaufruf hat ein eigenes Timeout. Ein Timeout oder eine Exception zählt
 * als Fehlschlag dieser einen Quelle und ergibt eine leere Menge; die übrigen Quellen laufen weiter.
 */
@Service
public class InteractionGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(InteractionGraphBuilder.class);

    private final ExecutorService executor;
    private final long timeoutMs;

    public InteractionGraphBuilder(
            ExecutorService sourceExecutor,
            @Value("${medcontext.sources.timeout-ms:10000}") long timeoutMs
    ) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("medcontext.sources.timeout-ms must be positive");
        }
        this.executor = sourceExecutor;
        this.timeoutMs = timeoutMs;
    }

    public NeighborSet aggregate(Subject subject, List<? extends KnowledgeSource> sources) {
        requireSubject(subject, "subject");
        requireSources(sources);
        return join(subject, fanOut(subject, sources));
    }

    public InteractionReport buildReport(String subjectA, String subjectB, List<? extends KnowledgeSource> sources) {
        return buildReport(Subject.of(subjectA), Subject.of(subjectB), sources);
    }

    public InteractionReport buildReport(Subject subjectA, Subject subjectB, List<? extends KnowledgeSource> sources) {
        requireSubject(subjectA, "subjectA");
        requireSubject(subjectB, "subjectB");
        requireSources(sources);

        // both subjects share one fan-out
        List<CompletableFuture<SourceResult>> pendingA = fanOut(subjectA, sources);
        List<CompletableFuture<SourceResult>> pendingB = fanOut(subjectB, sources);
        NeighborSet neighborsA = join(subjectA, pendingA);
        NeighborSet neighborsB = join(subjectB, pendingB);

        InteractionReport report = InteractionReport.of(neighborsA, neighborsB);
        log.info("Interaction {} ↔ {}: direct={} common={} ({} / {} neighbors)",
                subjectA, subjectB, report.direct(), report.common().size(),
                report.neighborsA().size(), report.neighborsB().size());
        return report;
    }

    // --- helpers ---

    private List<CompletableFuture<SourceResult>> fanOut(Subject subject, List<? extends KnowledgeSource> sources) {
        return sources.stream()
                .map(source -> fetchAsync(source, subject))
                .toList();
    }

    private CompletableFuture<SourceResult> fetchAsync(KnowledgeSource source, Subject subject) {
        String name = sourceName(source);
        CompletableFuture<SourceResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> source.fetch(subject), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] could not be scheduled for '{}': {}", name, subject, e.getMessage());
            return CompletableFuture.completedFuture(SourceResult.failure(name, "rejected: " + e.getMessage()));
        }
        return future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null) return failure(name, subject, error);
                    if (result == null) return SourceResult.failure(name, "no result");
                    return result;
                });
    }

    private SourceResult failure(String name, Subject subject, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("[{}] timed out after {} ms for '{}'", name, timeoutMs, subject);
            return SourceResult.failure(name, "timeout");
        }
        log.warn("[{}] failed for '{}'", name, subject, cause);
        return SourceResult.failure(name, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private NeighborSet join(Subject subject, List<CompletableFuture<SourceResult>> pending) {
        List<SourceResult> outcomes = pending.stream().map(CompletableFuture::join).toList();
        NeighborSet neighbors = NeighborSet.union(subject, outcomes);
        log.debug("Neighbors of {}: {}", subject, neighbors.names());
        if (!neighbors.failures().isEmpty()) {
            log.info("{}: {}/{} source(s) failed: {}", subject, neighbors.failures().size(), outcomes.size(),
                    neighbors.failures().stream().map(SourceResult::source).toList());
        }
        return neighbors;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String sourceName(KnowledgeSource source) {
        try {
            String name = source.name();
            return name == null || name.isBlank() ? source.getClass().getSimpleName() : name;
        } catch (RuntimeException e) {
            return source.getClass().getSimpleName();
        }
    }

    private static void requireSubject(Subject subject, String parameter) {
        if (subject == null) {
            throw new ValidationException(parameter + " must not be null");
        }
    }

    private static void requireSources(List<? extends KnowledgeSource> sources) {
        if (sources == null) {
            throw new ValidationException("Source list must not be null");
        }
        if (sources.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("Source list must not contain null entries");
        }
    }
}

package de.conciso.medcontext.runner;

import de.conciso.medcontext.model.InteractionReport;
import de.conciso.medcontext.model.ValidationException;
import de.conciso.medcontext.report.ReportWriter;
import de.conciso.medcontext.service.MedContextService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Wird aktiv wenn MEDCONTEXT_MODE=interaction (Standard).
 * Vergleicht zwei Subjekte (MEDCONTEXT_SUBJECTS_A / _B) über alle Wissensquellen.
 */
@Component
@ConditionalOnProperty(name = "medcontext.mode", havingValue = "interaction", matchIfMissing = true)
public class InteractionRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(InteractionRunner.class);

    private final MedContextService medContextService;
    private final ReportWriter reportWriter;
    private final String subjectA;
    private final String subjectB;

    public InteractionRunner(MedContextService medContextService,
                             ReportWriter reportWriter,
                             @Value("${medcontext.subjects.a:}") String subjectA,
                             @Value("${medcontext.subjects.b:}") String subjectB) {
        this.medContextService = medContextService;
        this.reportWriter = reportWriter;
        this.subjectA = subjectA;
        this.subjectB = subjectB;
    }

    @Override
    public void run(String... args) {
        System.out.println();
        System.out.println("=== MedContext: Interaction ===");
        System.out.println("Sources : " + String.join(", ", medContextService.sourceNames()));
        System.out.println();

        InteractionReport report;
        try {
            report = medContextService.buildInteractionReport(subjectA, subjectB);
        } catch (ValidationException e) {
            log.error("Invalid subjects (set medcontext.subjects.a and medcontext.subjects.b): {}", e.getMessage());
            return;
        }

        printReport(report);
        reportWriter.write(report);
    }

    private void printReport(InteractionReport report) {
        String sep = "-".repeat(72);
        System.out.printf("Interaction Report (%s vs %s)%n", report.subjectA(), report.subjectB());
        System.out.println(sep);
        System.out.println("Direct interaction : " + (report.direct() ? "Yes" : "No"));
        System.out.println("Shared interactions: " + join(report.common()));
        System.out.printf("Neighbors %-9s: %s%n", report.subjectA(), join(report.neighborsA()));
        System.out.printf("Neighbors %-9s: %s%n", report.subjectB(), join(report.neighborsB()));
        System.out.println(sep);
        System.out.println();
    }

    private static String join(Collection<String> names) {
        return names.isEmpty() ? "None" : String.join(", ", names);
    }
}

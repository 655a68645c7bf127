package de.conciso.medcontext.runner;

import de.conciso.medcontext.model.BundleEntry;
import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.PatientCase;
import de.conciso.medcontext.model.ValidationException;
import de.conciso.medcontext.report.ReportWriter;
import de.conciso.medcontext.service.CaseFileLoader;
import de.conciso.medcontext.service.MedContextService;
import de.conciso.medcontext.token.TokenizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Wird aktiv wenn MEDCONTEXT_MODE=context.
 * Liest eine Fall-Datei, sammelt Kontext zu allen Medikamenten und der Krankheit
 * und kürzt ihn auf MEDCONTEXT_CONTEXT_MAX_TOKENS.
 */
@Component
@ConditionalOnProperty(name = "medcontext.mode", havingValue = "context")
public class ContextRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ContextRunner.class);

    private final CaseFileLoader loader;
    private final MedContextService medContextService;
    private final ReportWriter reportWriter;
    private final int maxTokens;

    public ContextRunner(CaseFileLoader loader,
                         MedContextService medContextService,
                         ReportWriter reportWriter,
                         @Value("${medcontext.context.max-tokens:3000}") int maxTokens) {
        this.loader = loader;
        this.medContextService = medContextService;
        this.reportWriter = reportWriter;
        this.maxTokens = maxTokens;
    }

    @Override
    public void run(String... args) {
        System.out.println();
        System.out.println("=== MedContext: Context ===");
        System.out.println("Case file : " + loader.casePath());
        System.out.println("Budget    : " + maxTokens + " tokens");
        System.out.println();

        PatientCase patientCase;
        try {
            patientCase = loader.load();
        } catch (IOException e) {
            log.error("Case file could not be read: {}", loader.casePath(), e);
            return;
        }

        List<ContextSection> sections = medContextService.collectContext(patientCase);
        log.info("Collected {} section(s)", sections.size());

        ContextBundle bundle;
        try {
            bundle = medContextService.assembleContext(sections, maxTokens);
        } catch (ValidationException e) {
            log.error("Context could not be assembled (check medcontext.context.max-tokens): {}", e.getMessage());
            return;
        } catch (TokenizationException e) {
            log.error("Context could not be tokenized", e);
            return;
        }

        printSummary(sections, bundle);
        reportWriter.write(bundle, patientCase.id());
    }

    private void printSummary(List<ContextSection> sections, ContextBundle bundle) {
        String sep = "-".repeat(72);
        System.out.printf("%-50s %8s %8s%n", "Section", "Tokens", "Status");
        System.out.println(sep);
        for (BundleEntry e : bundle.entries()) {
            System.out.printf("%-50s %8d %8s%n", e.label(), e.tokenCount(), e.truncated() ? "cut" : "full");
        }
        for (ContextSection s : sections) {
            if (bundle.get(s.label()).isEmpty()) {
                System.out.printf("%-50s %8s %8s%n", s.label(), "-", "dropped");
            }
        }
        System.out.println(sep);
        System.out.printf("%-50s %8s%n", "Total", bundle.totalTokens() + "/" + bundle.maxTokens());
        System.out.println();
    }
}

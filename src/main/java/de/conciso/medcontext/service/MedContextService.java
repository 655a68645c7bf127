package de.conciso.medcontext.service;

import de.conciso.medcontext.api.KnowledgeSource;
import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.InteractionReport;
import de.conciso.medcontext.model.PatientCase;
import de.conciso.medcontext.token.Tokenizer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Öffentliche Operationen für Aufrufer (CLI, andere Dienste).
 * Die Varianten ohne Quellen/Tokenizer verwenden die konfigurierten.
 */
@Service
public class MedContextService {

    private final InteractionGraphBuilder graphBuilder;
    private final TokenBudgetAllocator allocator;
    private final ContextCollector collector;
    private final List<KnowledgeSource> sources;
    private final Tokenizer tokenizer;

    public MedContextService(InteractionGraphBuilder graphBuilder,
                             TokenBudgetAllocator allocator,
                             ContextCollector collector,
                             List<KnowledgeSource> sources,
                             Tokenizer tokenizer) {
        this.graphBuilder = graphBuilder;
        this.allocator = allocator;
        this.collector = collector;
        this.sources = List.copyOf(sources);
        this.tokenizer = tokenizer;
    }

    public InteractionReport buildInteractionReport(String subjectA, String subjectB,
                                                    List<? extends KnowledgeSource> adapters) {
        return graphBuilder.buildReport(subjectA, subjectB, adapters);
    }

    public InteractionReport buildInteractionReport(String subjectA, String subjectB) {
        return buildInteractionReport(subjectA, subjectB, sources);
    }

    public ContextBundle assembleContext(List<ContextSection> sections, int maxTokens, Tokenizer tokenizer) {
        return allocator.assemble(sections, maxTokens, tokenizer);
    }

    public ContextBundle assembleContext(List<ContextSection> sections, int maxTokens) {
        return assembleContext(sections, maxTokens, tokenizer);
    }

    public List<ContextSection> collectContext(PatientCase patientCase) {
        return collector.collect(patientCase);
    }

    public List<String> sourceNames() {
        return sources.stream().map(KnowledgeSource::name).toList();
    }
}

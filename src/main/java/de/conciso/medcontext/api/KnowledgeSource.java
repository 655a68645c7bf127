package de.conciso.medcontext.api;

import de.conciso.medcontext.model.SourceResult;
import de.conciso.medcontext.model.Subject;

/**
 * Eine Wissensquelle, die zu einem Subjekt verwandte Entitäten liefert.
 * {@link #fetch(Subject)} wirft nie; Fehler werden als {@link SourceResult#failure} gemeldet.
 */
public interface KnowledgeSource {

    String name();

    SourceResult fetch(Subject subject);
}

package de.conciso.medcontext.model;

/**
 * Inhalt eines Kontext-Abschnitts. Ob Einzeltext oder Liste wird beim Erzeugen entschieden,
 * nicht erst beim Serialisieren.
 */
public interface SectionValue {

    /** Text, der gemessen und ggf. gekürzt wird. */
    String serialize();
}

package de.conciso.medcontext.token;

/**
 * Misst Text in Tokens. Nur Länge und Encode/Decode-Roundtrip sind relevant,
 * die Bedeutung einzelner Token-IDs nicht.
 */
public interface Tokenizer {

    /** Reihenfolgeerhaltend und deterministisch für denselben Text. */
    int[] encode(String text);

    /** Für ein Präfix von {@code encode(x)} ein anzeigbares Präfix von {@code x}. */
    String decode(int[] tokens);
}

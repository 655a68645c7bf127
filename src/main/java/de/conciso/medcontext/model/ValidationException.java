package de.conciso.medcontext.model;

/**
 * Verletzung des Aufrufer-Vertrags (leeres Subjekt, ungültiges Budget, doppelte Labels ...).
 * Wird geworfen, bevor ein Adapter oder Tokenizer aufgerufen wird.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}

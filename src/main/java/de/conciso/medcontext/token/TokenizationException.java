package de.conciso.medcontext.token;

/**
 * The tokenizer could not encode or decode a text. Truncation cannot be trusted without it.
 */
public class TokenizationException extends RuntimeException {

    public TokenizationException(String message, Throwable cause) {
        super(message, cause);
    }
}

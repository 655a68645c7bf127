package de.conciso.medcontext.api;

/**
 * Raised inside an adapter when a query cannot be issued at all (missing credential,
 * unsupported subject). Never leaves the adapter boundary.
 */
class SourceUnavailableException extends RuntimeException {

    SourceUnavailableException(String message) {
        super(message);
    }
}

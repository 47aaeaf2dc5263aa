package com.tony.esportsAnalytics.exception;

/**
 * Violation d'une clé d'identité, ou doublon sur un registre (ex : source déjà déclarée).
 */
public class ConflictException extends EsportsDataException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

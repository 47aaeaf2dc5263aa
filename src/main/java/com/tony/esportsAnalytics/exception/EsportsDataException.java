package com.tony.esportsAnalytics.exception;

/**
 * Racine des erreurs métier. Toutes non vérifiées : elles remontent jusqu'au
 * {@link GlobalExceptionHandler} ou jusqu'à l'appelant de l'ingestion.
 */
public abstract class EsportsDataException extends RuntimeException {

    protected EsportsDataException(String message) {
        super(message);
    }

    protected EsportsDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

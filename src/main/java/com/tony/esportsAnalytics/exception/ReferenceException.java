package com.tony.esportsAnalytics.exception;

/**
 * Une entité référencée (équipe, tournoi, match) n'a pas pu être résolue en base.
 * La résolution crée ce qui manque : si on arrive ici, c'est un défaut de stockage.
 */
public class ReferenceException extends EsportsDataException {

    public ReferenceException(String message) {
        super(message);
    }

    public ReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.tony.esportsAnalytics.exception;

/**
 * Ressource demandée introuvable (match, source...) : réponse 404.
 */
public class ResourceNotFoundException extends EsportsDataException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resourceType, Object id) {
        super(String.format("%s introuvable : %s", resourceType, id));
    }
}

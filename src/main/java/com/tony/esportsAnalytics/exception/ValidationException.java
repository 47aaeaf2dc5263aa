package com.tony.esportsAnalytics.exception;

/**
 * Payload fournisseur mal formé ou incomplet. Ne doit pas être rejoué tel quel.
 */
public class ValidationException extends EsportsDataException {

    public ValidationException(String message) {
        super(message);
    }
}

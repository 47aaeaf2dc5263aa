package com.tony.esportsAnalytics.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.dto.MatchData;

/**
 * Traduit le payload brut d'UN fournisseur vers les enregistrements typés.
 * Une implémentation par source, détectée par Spring et indexée par {@link #sourceType()}.
 */
public interface ProviderPayloadMapper {

    /** Identifiant de la source, en minuscules ('bo3'). */
    String sourceType();

    String displayName();

    /**
     * @throws com.tony.esportsAnalytics.exception.ValidationException si un champ obligatoire
     *         manque ou est mal formé
     */
    MatchData toMatch(JsonNode payload);
}

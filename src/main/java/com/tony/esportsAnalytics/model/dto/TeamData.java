package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Équipe extraite d'un payload fournisseur, avant résolution.
 */
@Value
@Builder
public class TeamData {
    Long sourceId;
    String name;
    String slug;
    String countryCode;
    String logoUrl;
    JsonNode metadata;
}

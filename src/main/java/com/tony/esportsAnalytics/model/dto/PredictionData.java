package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PredictionData {
    // Peut être null : certaines sources ne numérotent pas leurs prédictions
    Long sourceId;
    JsonNode payload;
}

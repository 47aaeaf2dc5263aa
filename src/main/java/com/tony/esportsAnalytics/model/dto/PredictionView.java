package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.Prediction;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

@Value
@Builder
public class PredictionView {
    UUID id;
    String sourceType;
    Long sourceId;
    JsonNode payload;
    LocalDateTime updatedAt;

    public static PredictionView from(Prediction prediction) {
        return PredictionView.builder()
                .id(prediction.getId())
                .sourceType(prediction.getSourceType())
                .sourceId(prediction.getSourceId())
                .payload(prediction.getPredictionPayload())
                .updatedAt(prediction.getUpdatedAt())
                .build();
    }
}

package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Confrontation prédiction / résultat réel d'un match.
 * {@code applicable = false} n'est pas une erreur : match pas encore terminé, pas de prédiction...
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparisonResult {
    UUID matchId;
    boolean applicable;
    String reason;

    String predictionSourceType;
    UUID predictedWinnerTeamId;
    UUID actualWinnerTeamId;
    Boolean correct;

    // overall_proximity_factor du payload, quand il existe
    Double confidence;

    String predictedScore;
    String actualScore;
    Boolean exactScoreCorrect;

    public static ComparisonResult notApplicable(UUID matchId, String reason) {
        return ComparisonResult.builder()
                .matchId(matchId)
                .applicable(false)
                .reason(reason)
                .build();
    }
}

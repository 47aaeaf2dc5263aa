package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Match extrait d'un payload fournisseur, avec ses sous-objets imbriqués non encore résolus.
 */
@Value
@Builder
public class MatchData {
    Long sourceId;
    String slug;
    MatchStatus status;
    LocalDateTime startDate;
    Integer boType;
    String tier;
    Integer team1Score;
    Integer team2Score;
    // Vainqueur annoncé par le fournisseur (id local à la source), contrôlé contre les scores
    Long declaredWinnerSourceId;

    TeamData team1;
    TeamData team2;
    TournamentData tournament;
    PredictionData prediction;
    @Builder.Default
    List<OddsData> odds = List.of();

    JsonNode rawPayload;
}

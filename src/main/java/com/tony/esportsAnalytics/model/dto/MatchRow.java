package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ligne "matches" prête à l'upsert : références déjà résolues en ids canoniques.
 */
@Value
@Builder
public class MatchRow {
    String sourceType;
    Long sourceId;
    String slug;
    UUID team1Id;
    UUID team2Id;
    UUID tournamentId;
    MatchStatus status;
    LocalDateTime startDate;
    Integer boType;
    String tier;
    Integer team1Score;
    Integer team2Score;
    UUID winnerTeamId;
    UUID loserTeamId;
    JsonNode rawPayload;
    LocalDateTime fetchedAt;
}

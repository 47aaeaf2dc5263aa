package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class TournamentData {
    Long sourceId;
    String name;
    String slug;
    String tier;
    Integer tierRank;
    Long prizePool;
    Integer disciplineId;
    String status;
    LocalDateTime startDate;
    LocalDateTime endDate;
    JsonNode metadata;
}

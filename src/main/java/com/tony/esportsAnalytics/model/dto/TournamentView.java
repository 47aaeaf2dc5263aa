package com.tony.esportsAnalytics.model.dto;

import com.tony.esportsAnalytics.model.Tournament;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

@Value
@Builder
public class TournamentView {
    UUID id;
    Long sourceId;
    String name;
    String slug;
    String tier;
    Integer tierRank;
    Long prizePool;
    String status;
    LocalDateTime startDate;
    LocalDateTime endDate;

    public static TournamentView from(Tournament tournament) {
        if (tournament == null) return null;
        return TournamentView.builder()
                .id(tournament.getId())
                .sourceId(tournament.getSourceId())
                .name(tournament.getName())
                .slug(tournament.getSlug())
                .tier(tournament.getTier())
                .tierRank(tournament.getTierRank())
                .prizePool(tournament.getPrizePool())
                .status(tournament.getStatus())
                .startDate(tournament.getStartDate())
                .endDate(tournament.getEndDate())
                .build();
    }
}

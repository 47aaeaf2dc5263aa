package com.tony.esportsAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.Match;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.Team;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Vue de lecture d'un match. Prédictions, cotes et payload brut ne sont remplis
 * que si le détail est demandé.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchView {
    UUID id;
    String sourceType;
    Long sourceId;
    String slug;
    MatchStatus status;
    LocalDateTime startDate;
    Integer boType;
    String tier;
    TeamView team1;
    TeamView team2;
    TournamentView tournament;
    Integer team1Score;
    Integer team2Score;
    UUID winnerTeamId;
    UUID loserTeamId;
    LocalDateTime lastFetchedAt;

    JsonNode rawPayload;
    List<PredictionView> predictions;
    List<OddsQuoteView> odds;

    public static MatchView from(Match match, boolean includeDetails) {
        MatchViewBuilder builder = MatchView.builder()
                .id(match.getId())
                .sourceType(match.getSourceType())
                .sourceId(match.getSourceId())
                .slug(match.getSlug())
                .status(match.getStatus())
                .startDate(match.getStartDate())
                .boType(match.getBoType())
                .tier(match.getTier())
                .team1(TeamView.from(match.getTeam1()))
                .team2(TeamView.from(match.getTeam2()))
                .tournament(TournamentView.from(match.getTournament()))
                .team1Score(match.getTeam1Score())
                .team2Score(match.getTeam2Score())
                .winnerTeamId(idOf(match.getWinner()))
                .loserTeamId(idOf(match.getLoser()))
                .lastFetchedAt(match.getLastFetchedAt());

        if (includeDetails) {
            builder.rawPayload(match.getRawPayload())
                    .predictions(match.getPredictions().stream().map(PredictionView::from).toList())
                    .odds(match.getOddsQuotes().stream().map(OddsQuoteView::from).toList());
        }
        return builder.build();
    }

    private static UUID idOf(Team team) {
        return team != null ? team.getId() : null;
    }
}

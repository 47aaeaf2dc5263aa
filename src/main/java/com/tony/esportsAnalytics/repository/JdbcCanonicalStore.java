package com.tony.esportsAnalytics.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.exception.ConflictException;
import com.tony.esportsAnalytics.exception.ReferenceException;
import com.tony.esportsAnalytics.model.dto.*;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Upserts PostgreSQL ({@code INSERT ... ON CONFLICT ... DO UPDATE ... RETURNING id}).
 * L'id proposé n'est retenu que si la ligne n'existait pas encore : en cas de conflit,
 * RETURNING renvoie l'id déjà en place. Les colonnes mutables sont intégralement écrasées,
 * {@code created_at} jamais.
 */
@Repository
@RequiredArgsConstructor
public class JdbcCanonicalStore implements CanonicalStore {

    private static final String UPSERT_TEAM = """
        INSERT INTO teams (id, source_type, source_id, name, slug, country_code, logo_url, metadata, created_at, updated_at)
        VALUES (:id, :sourceType, :sourceId, :name, :slug, :countryCode, :logoUrl, CAST(:metadata AS jsonb), :now, :now)
        ON CONFLICT (source_type, source_id) DO UPDATE SET
            name = EXCLUDED.name,
            slug = EXCLUDED.slug,
            country_code = EXCLUDED.country_code,
            logo_url = EXCLUDED.logo_url,
            metadata = EXCLUDED.metadata,
            updated_at = EXCLUDED.updated_at
        RETURNING id
        """;

    private static final String UPSERT_TOURNAMENT = """
        INSERT INTO tournaments (id, source_type, source_id, name, slug, tier, tier_rank, prize_pool, discipline_id,
                                 status, start_date, end_date, metadata, created_at, updated_at)
        VALUES (:id, :sourceType, :sourceId, :name, :slug, :tier, :tierRank, :prizePool, :disciplineId,
                :status, :startDate, :endDate, CAST(:metadata AS jsonb), :now, :now)
        ON CONFLICT (source_type, source_id) DO UPDATE SET
            name = EXCLUDED.name,
            slug = EXCLUDED.slug,
            tier = EXCLUDED.tier,
            tier_rank = EXCLUDED.tier_rank,
            prize_pool = EXCLUDED.prize_pool,
            discipline_id = EXCLUDED.discipline_id,
            status = EXCLUDED.status,
            start_date = EXCLUDED.start_date,
            end_date = EXCLUDED.end_date,
            metadata = EXCLUDED.metadata,
            updated_at = EXCLUDED.updated_at
        RETURNING id
        """;

    private static final String UPSERT_MATCH = """
        INSERT INTO matches (id, source_type, source_id, slug, team1_id, team2_id, tournament_id, status, start_date,
                             bo_type, tier, team1_score, team2_score, winner_team_id, loser_team_id, raw_payload,
                             created_at, updated_at, last_fetched_at)
        VALUES (:id, :sourceType, :sourceId, :slug, :team1Id, :team2Id, :tournamentId, :status, :startDate,
                :boType, :tier, :team1Score, :team2Score, :winnerTeamId, :loserTeamId, CAST(:rawPayload AS jsonb),
                :now, :now, :now)
        ON CONFLICT (source_type, source_id) DO UPDATE SET
            slug = EXCLUDED.slug,
            team1_id = EXCLUDED.team1_id,
            team2_id = EXCLUDED.team2_id,
            tournament_id = EXCLUDED.tournament_id,
            status = EXCLUDED.status,
            start_date = EXCLUDED.start_date,
            bo_type = EXCLUDED.bo_type,
            tier = EXCLUDED.tier,
            team1_score = EXCLUDED.team1_score,
            team2_score = EXCLUDED.team2_score,
            winner_team_id = EXCLUDED.winner_team_id,
            loser_team_id = EXCLUDED.loser_team_id,
            raw_payload = EXCLUDED.raw_payload,
            updated_at = EXCLUDED.updated_at,
            last_fetched_at = EXCLUDED.last_fetched_at
        RETURNING id
        """;

    private static final String UPSERT_PREDICTION = """
        INSERT INTO ai_predictions (id, match_id, source_type, source_id, prediction_payload, created_at, updated_at)
        VALUES (:id, :matchId, :sourceType, :sourceId, CAST(:payload AS jsonb), :now, :now)
        ON CONFLICT (match_id, source_type) DO UPDATE SET
            source_id = EXCLUDED.source_id,
            prediction_payload = EXCLUDED.prediction_payload,
            updated_at = EXCLUDED.updated_at
        RETURNING id
        """;

    private static final String UPSERT_ODDS = """
        INSERT INTO betting_odds (id, match_id, source_type, provider, team1_odds, team2_odds,
                                  team1_implied_prob, team2_implied_prob, odds_payload, fetched_at, created_at, updated_at)
        VALUES (:id, :matchId, :sourceType, :provider, :team1Odds, :team2Odds,
                :team1Implied, :team2Implied, CAST(:payload AS jsonb), :now, :now, :now)
        ON CONFLICT (match_id, source_type, provider) DO UPDATE SET
            team1_odds = EXCLUDED.team1_odds,
            team2_odds = EXCLUDED.team2_odds,
            team1_implied_prob = EXCLUDED.team1_implied_prob,
            team2_implied_prob = EXCLUDED.team2_implied_prob,
            odds_payload = EXCLUDED.odds_payload,
            fetched_at = EXCLUDED.fetched_at,
            updated_at = EXCLUDED.updated_at
        RETURNING id
        """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public UUID upsertTeam(String sourceType, TeamData team, LocalDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("sourceType", sourceType)
                .addValue("sourceId", team.getSourceId())
                .addValue("name", team.getName())
                .addValue("slug", team.getSlug())
                .addValue("countryCode", team.getCountryCode())
                .addValue("logoUrl", team.getLogoUrl())
                .addValue("metadata", json(team.getMetadata()))
                .addValue("now", now);
        return upsert(UPSERT_TEAM, params, "équipe " + sourceType + "/" + team.getSourceId());
    }

    @Override
    public UUID upsertTournament(String sourceType, TournamentData tournament, LocalDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("sourceType", sourceType)
                .addValue("sourceId", tournament.getSourceId())
                .addValue("name", tournament.getName())
                .addValue("slug", tournament.getSlug())
                .addValue("tier", tournament.getTier())
                .addValue("tierRank", tournament.getTierRank())
                .addValue("prizePool", tournament.getPrizePool())
                .addValue("disciplineId", tournament.getDisciplineId())
                .addValue("status", tournament.getStatus())
                .addValue("startDate", tournament.getStartDate())
                .addValue("endDate", tournament.getEndDate())
                .addValue("metadata", json(tournament.getMetadata()))
                .addValue("now", now);
        return upsert(UPSERT_TOURNAMENT, params, "tournoi " + sourceType + "/" + tournament.getSourceId());
    }

    @Override
    public UUID upsertMatch(MatchRow match) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("sourceType", match.getSourceType())
                .addValue("sourceId", match.getSourceId())
                .addValue("slug", match.getSlug())
                .addValue("team1Id", match.getTeam1Id())
                .addValue("team2Id", match.getTeam2Id())
                .addValue("tournamentId", match.getTournamentId())
                .addValue("status", match.getStatus().name())
                .addValue("startDate", match.getStartDate())
                .addValue("boType", match.getBoType())
                .addValue("tier", match.getTier())
                .addValue("team1Score", match.getTeam1Score())
                .addValue("team2Score", match.getTeam2Score())
                .addValue("winnerTeamId", match.getWinnerTeamId())
                .addValue("loserTeamId", match.getLoserTeamId())
                .addValue("rawPayload", json(match.getRawPayload()))
                .addValue("now", match.getFetchedAt());
        return upsert(UPSERT_MATCH, params, "match " + match.getSourceType() + "/" + match.getSourceId());
    }

    @Override
    public UUID upsertPrediction(UUID matchId, String sourceType, PredictionData prediction, LocalDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("matchId", matchId)
                .addValue("sourceType", sourceType)
                .addValue("sourceId", prediction.getSourceId())
                .addValue("payload", json(prediction.getPayload()))
                .addValue("now", now);
        return upsert(UPSERT_PREDICTION, params, "prédiction " + sourceType + " du match " + matchId);
    }

    @Override
    public UUID upsertOddsQuote(UUID matchId, String sourceType, OddsData odds,
                                Double team1ImpliedProb, Double team2ImpliedProb, LocalDateTime fetchedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("matchId", matchId)
                .addValue("sourceType", sourceType)
                .addValue("provider", odds.getProvider())
                .addValue("team1Odds", odds.getTeam1Odds())
                .addValue("team2Odds", odds.getTeam2Odds())
                .addValue("team1Implied", team1ImpliedProb)
                .addValue("team2Implied", team2ImpliedProb)
                .addValue("payload", json(odds.getPayload()))
                .addValue("now", fetchedAt);
        return upsert(UPSERT_ODDS, params, "cotes " + odds.getProvider() + " du match " + matchId);
    }

    private UUID upsert(String sql, MapSqlParameterSource params, String what) {
        try {
            return jdbc.queryForObject(sql, params, UUID.class);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Conflit d'unicité sur " + what, e);
        } catch (DataIntegrityViolationException e) {
            // Clé étrangère vers une équipe/un tournoi/un match absent : bug en amont
            throw new ReferenceException("Référence introuvable pour " + what, e);
        } catch (EmptyResultDataAccessException e) {
            throw new ReferenceException("Aucun id renvoyé pour " + what, e);
        }
    }

    private String json(JsonNode node) {
        return node != null && !node.isNull() ? node.toString() : null;
    }
}

package com.tony.esportsAnalytics.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.mapper.Bo3Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ingestion contre un vrai PostgreSQL : transactions, contraintes et suppressions en cascade
 * que le stockage en mémoire ne reproduit pas.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Testcontainers(disabledWithoutDocker = true)
class MatchIngestionIntegrationTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private static final String CANONICAL_COLUMNS = """
            SELECT id, team1_id, team2_id, tournament_id, status, team1_score, team2_score,
                   winner_team_id, loser_team_id, raw_payload::text AS raw_payload
            FROM matches
            """;

    @Autowired
    private MatchIngestionService matchIngestionService;

    @Autowired
    private MatchQueryService matchQueryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM betting_odds");
        jdbcTemplate.update("DELETE FROM ai_predictions");
        jdbcTemplate.update("DELETE FROM matches");
        jdbcTemplate.update("DELETE FROM tournaments");
        jdbcTemplate.update("DELETE FROM teams");
    }

    @Test
    @DisplayName("Un échec après la résolution des équipes annule tout le match")
    void failureAfterTeamResolutionRollsBackWholeMatch() {
        ObjectNode tie = Bo3Payloads.finishedMatch().put("team2_score", 2);

        assertThatThrownBy(() -> matchIngestionService.ingestMatch(tie, "bo3"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("égalité");

        assertThat(count("teams")).isZero();
        assertThat(count("tournaments")).isZero();
        assertThat(count("matches")).isZero();
        assertThat(count("ai_predictions")).isZero();
        assertThat(count("betting_odds")).isZero();
    }

    @Test
    @DisplayName("Réingérer le même payload ne crée aucun doublon et laisse les colonnes canoniques inchangées")
    void reingestionIsIdempotent() {
        ObjectNode payload = Bo3Payloads.finishedMatch();

        UUID firstId = matchIngestionService.ingestMatch(payload, "bo3");
        Map<String, Object> first = jdbcTemplate.queryForMap(CANONICAL_COLUMNS);

        UUID secondId = matchIngestionService.ingestMatch(payload.deepCopy(), "bo3");
        Map<String, Object> second = jdbcTemplate.queryForMap(CANONICAL_COLUMNS);

        assertThat(secondId).isEqualTo(firstId);
        assertThat(second).isEqualTo(first);
        assertThat(count("teams")).isEqualTo(2);
        assertThat(count("tournaments")).isEqualTo(1);
        assertThat(count("matches")).isEqualTo(1);
        assertThat(count("ai_predictions")).isEqualTo(1);
        assertThat(count("betting_odds")).isEqualTo(1);
    }

    @Test
    @DisplayName("Supprimer un match supprime ses prédictions et ses cotes")
    void deletingMatchCascadesToPredictionsAndOdds() {
        UUID matchId = matchIngestionService.ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");
        assertThat(count("ai_predictions")).isEqualTo(1);
        assertThat(count("betting_odds")).isEqualTo(1);

        matchQueryService.deleteMatch(matchId);

        assertThat(count("matches")).isZero();
        assertThat(count("ai_predictions")).isZero();
        assertThat(count("betting_odds")).isZero();
        assertThat(count("teams")).isEqualTo(2);
    }

    @Test
    @DisplayName("La cascade est portée par la base, même pour une suppression SQL directe")
    void databaseForeignKeysCascadeOnDelete() {
        UUID matchId = matchIngestionService.ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");

        jdbcTemplate.update("DELETE FROM matches WHERE id = ?", matchId);

        assertThat(count("ai_predictions")).isZero();
        assertThat(count("betting_odds")).isZero();
    }

    private long count(String table) {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return value != null ? value : 0L;
    }
}

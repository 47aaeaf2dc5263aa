package com.tony.esportsAnalytics.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.mapper.Bo3PayloadMapper;
import com.tony.esportsAnalytics.mapper.Bo3Payloads;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.MatchRow;
import com.tony.esportsAnalytics.model.dto.PredictionData;
import com.tony.esportsAnalytics.repository.InMemoryCanonicalStore;
import com.tony.esportsAnalytics.repository.InMemoryCanonicalStore.Stored;
import com.tony.esportsAnalytics.repository.InMemoryCanonicalStore.StoredOdds;
import com.tony.esportsAnalytics.repository.MatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchIngestionServiceTest {

    private static final Instant FIRST_FETCH = Instant.parse("2025-03-14T12:00:00Z");
    private static final Instant SECOND_FETCH = Instant.parse("2025-03-14T20:30:00Z");

    @Mock
    private MatchRepository matchRepository;

    private InMemoryCanonicalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
    }

    @Test
    @DisplayName("Rejouer le même payload ne crée rien de nouveau, seul last_fetched_at avance")
    void ingestionIsIdempotent() {
        UUID first = service(FIRST_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");
        UUID second = service(SECOND_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");

        assertThat(second).isEqualTo(first);
        assertThat(store.teams).hasSize(2);
        assertThat(store.tournaments).hasSize(1);
        assertThat(store.matches).hasSize(1);
        assertThat(store.predictions).hasSize(1);
        assertThat(store.odds).hasSize(1);

        Stored<MatchRow> match = store.matchById(first);
        assertThat(match.createdAt()).isEqualTo(LocalDateTime.of(2025, 3, 14, 12, 0));
        assertThat(match.data().getFetchedAt()).isEqualTo(LocalDateTime.of(2025, 3, 14, 20, 30));
    }

    @Test
    @DisplayName("Un match à venir n'a ni score ni vainqueur")
    void upcomingMatchHasNoResult() {
        ObjectNode payload = Bo3Payloads.upcomingMatch();
        payload.put("team1_score", 1);
        payload.put("team2_score", 0);

        UUID id = service(FIRST_FETCH).ingestMatch(payload, "bo3");

        MatchRow row = store.matchById(id).data();
        assertThat(row.getStatus()).isEqualTo(MatchStatus.UPCOMING);
        assertThat(row.getTeam1Score()).isNull();
        assertThat(row.getTeam2Score()).isNull();
        assertThat(row.getWinnerTeamId()).isNull();
        assertThat(row.getLoserTeamId()).isNull();
    }

    @Test
    @DisplayName("Le passage à FINISHED met à jour le même match avec vainqueur et perdant")
    void finishedTransitionDerivesWinner() {
        UUID upcoming = service(FIRST_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");
        UUID finished = service(SECOND_FETCH).ingestMatch(Bo3Payloads.finishedMatch(), "bo3");

        assertThat(finished).isEqualTo(upcoming);
        MatchRow row = store.matchById(finished).data();
        assertThat(row.getStatus()).isEqualTo(MatchStatus.FINISHED);
        assertThat(row.getTeam1Score()).isEqualTo(2);
        assertThat(row.getTeam2Score()).isEqualTo(1);
        assertThat(row.getWinnerTeamId()).isEqualTo(row.getTeam1Id());
        assertThat(row.getLoserTeamId()).isEqualTo(row.getTeam2Id());
    }

    @Test
    @DisplayName("Un vainqueur annoncé incohérent est ignoré au profit du score")
    void scoreWinsOverDeclaredWinner() {
        ObjectNode payload = Bo3Payloads.finishedMatch();
        payload.put("team1_score", 0);
        payload.put("team2_score", 2);
        payload.put("winner_team_id", 1);

        UUID id = service(FIRST_FETCH).ingestMatch(payload, "bo3");

        MatchRow row = store.matchById(id).data();
        assertThat(row.getWinnerTeamId()).isEqualTo(row.getTeam2Id());
    }

    @Test
    @DisplayName("Un match terminé sur une égalité est rejeté")
    void finishedTieIsRejected() {
        ObjectNode payload = Bo3Payloads.finishedMatch();
        payload.put("team2_score", 2);
        payload.put("team1_score", 2);

        assertThatThrownBy(() -> service(FIRST_FETCH).ingestMatch(payload, "bo3"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("égalité");
        assertThat(store.matches).isEmpty();
    }

    @Test
    @DisplayName("Un match terminé sans score est rejeté")
    void finishedWithoutScoreIsRejected() {
        ObjectNode payload = Bo3Payloads.finishedMatch();
        payload.putNull("team2_score");

        assertThatThrownBy(() -> service(FIRST_FETCH).ingestMatch(payload, "bo3"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Une source sans mapper est rejetée")
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> service(FIRST_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "pandascore"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("pandascore");
        assertThat(store.teams).isEmpty();
    }

    @Test
    @DisplayName("Un match qui oppose une équipe à elle-même est rejeté")
    void sameTeamTwiceIsRejected() {
        ObjectNode payload = Bo3Payloads.upcomingMatch();
        ((ObjectNode) payload.get("team2")).put("id", 1);

        assertThatThrownBy(() -> service(FIRST_FETCH).ingestMatch(payload, "bo3"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Les cotes sont stockées avec leur probabilité implicite 1/cote")
    void oddsStoreImpliedProbabilities() {
        service(FIRST_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");

        StoredOdds odds = store.odds.values().iterator().next();
        assertThat(odds.data().getProvider()).isEqualTo("1xbit");
        assertThat(odds.team1ImpliedProb()).isEqualTo(0.5);
        assertThat(odds.team2ImpliedProb()).isCloseTo(1 / 1.8, within(1e-9));
    }

    @Test
    @DisplayName("Des cotes listées dans l'autre sens sont réalignées sur team1/team2 du match")
    void reversedOddsAreRealigned() {
        ObjectNode payload = Bo3Payloads.parse("""
            {"id": 2002, "status": "upcoming",
             "team1": {"id": 1, "name": "Natus Vincere"},
             "team2": {"id": 2, "name": "Vitality"},
             "bet_updates": [{"provider": "bet365",
                              "team_1": {"coeff": 1.8, "team_id": 2},
                              "team_2": {"coeff": 2.0, "team_id": 1}}]}
            """);

        service(FIRST_FETCH).ingestMatch(payload, "bo3");

        StoredOdds odds = store.odds.values().iterator().next();
        assertThat(odds.data().getTeam1Odds()).isEqualTo(2.0);
        assertThat(odds.data().getTeam2Odds()).isEqualTo(1.8);
        assertThat(odds.team1ImpliedProb()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Une prédiction pour un match inconnu est refusée")
    void predictionForUnknownMatchIsRejected() {
        UUID unknown = UUID.randomUUID();
        when(matchRepository.existsById(unknown)).thenReturn(false);
        PredictionData prediction = PredictionData.builder().payload(Bo3Payloads.parse("{\"id\": 1}")).build();

        assertThatThrownBy(() -> service(FIRST_FETCH).ingestPrediction(unknown, "bo3", prediction))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(store.predictions).isEmpty();
    }

    @Test
    @DisplayName("Re-ingérer une prédiction remplace la précédente pour la même source")
    void predictionIsOverwrittenPerSource() {
        UUID matchId = service(FIRST_FETCH).ingestMatch(Bo3Payloads.upcomingMatch(), "bo3");
        when(matchRepository.existsById(matchId)).thenReturn(true);

        PredictionData updated = PredictionData.builder()
                .sourceId(556L)
                .payload(Bo3Payloads.parse("{\"id\": 556, \"prediction_winner_team_id\": 2}"))
                .build();
        service(SECOND_FETCH).ingestPrediction(matchId, "BO3", updated);

        assertThat(store.predictions).hasSize(1);
        assertThat(store.predictions.values().iterator().next().data().getSourceId()).isEqualTo(556L);
    }

    private MatchIngestionService service(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        return new MatchIngestionService(List.of(new Bo3PayloadMapper()),
                new EntityResolverService(store, clock), store, matchRepository, clock);
    }
}

package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.dto.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Écritures atomiques du stockage canonique. Chaque méthode est un upsert sur la clé
 * d'identité de la table et renvoie l'id canonique, nouveau ou existant : deux appels
 * concurrents pour la même identité aboutissent toujours à une seule ligne.
 * <p>
 * Les lectures passent par les repositories Spring Data.
 *
 * @throws com.tony.esportsAnalytics.exception.ConflictException violation d'unicité remontée par la base
 * @throws com.tony.esportsAnalytics.exception.ReferenceException clé étrangère introuvable
 */
public interface CanonicalStore {

    UUID upsertTeam(String sourceType, TeamData team, LocalDateTime now);

    UUID upsertTournament(String sourceType, TournamentData tournament, LocalDateTime now);

    UUID upsertMatch(MatchRow match);

    UUID upsertPrediction(UUID matchId, String sourceType, PredictionData prediction, LocalDateTime now);

    UUID upsertOddsQuote(UUID matchId, String sourceType, OddsData odds,
                         Double team1ImpliedProb, Double team2ImpliedProb, LocalDateTime fetchedAt);
}

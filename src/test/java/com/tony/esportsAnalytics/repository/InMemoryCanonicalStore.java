package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.exception.ReferenceException;
import com.tony.esportsAnalytics.model.dto.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stockage en mémoire pour les tests : mêmes clés d'identité et même atomicité
 * (ConcurrentHashMap.compute) que les upserts PostgreSQL.
 */
public class InMemoryCanonicalStore implements CanonicalStore {

    public record Stored<T>(UUID id, T data, LocalDateTime createdAt, LocalDateTime updatedAt) {}

    public record StoredOdds(UUID id, OddsData data, Double team1ImpliedProb, Double team2ImpliedProb, LocalDateTime fetchedAt) {}

    public final Map<List<Object>, Stored<TeamData>> teams = new ConcurrentHashMap<>();
    public final Map<List<Object>, Stored<TournamentData>> tournaments = new ConcurrentHashMap<>();
    public final Map<List<Object>, Stored<MatchRow>> matches = new ConcurrentHashMap<>();
    public final Map<List<Object>, Stored<PredictionData>> predictions = new ConcurrentHashMap<>();
    public final Map<List<Object>, StoredOdds> odds = new ConcurrentHashMap<>();

    @Override
    public UUID upsertTeam(String sourceType, TeamData team, LocalDateTime now) {
        return teams.compute(List.of(sourceType, team.getSourceId()), (k, old) -> merge(old, team, now)).id();
    }

    @Override
    public UUID upsertTournament(String sourceType, TournamentData tournament, LocalDateTime now) {
        return tournaments.compute(List.of(sourceType, tournament.getSourceId()), (k, old) -> merge(old, tournament, now)).id();
    }

    @Override
    public UUID upsertMatch(MatchRow match) {
        requireTeam(match.getTeam1Id());
        requireTeam(match.getTeam2Id());
        return matches.compute(List.of(match.getSourceType(), match.getSourceId()),
                (k, old) -> merge(old, match, match.getFetchedAt())).id();
    }

    @Override
    public UUID upsertPrediction(UUID matchId, String sourceType, PredictionData prediction, LocalDateTime now) {
        requireMatch(matchId);
        return predictions.compute(List.of(matchId, sourceType), (k, old) -> merge(old, prediction, now)).id();
    }

    @Override
    public UUID upsertOddsQuote(UUID matchId, String sourceType, OddsData quote,
                                Double team1ImpliedProb, Double team2ImpliedProb, LocalDateTime fetchedAt) {
        requireMatch(matchId);
        return odds.compute(List.of(matchId, sourceType, quote.getProvider()), (k, old) -> new StoredOdds(
                old != null ? old.id() : UUID.randomUUID(), quote, team1ImpliedProb, team2ImpliedProb, fetchedAt)).id();
    }

    public Stored<MatchRow> matchById(UUID id) {
        return matches.values().stream().filter(m -> m.id().equals(id)).findFirst().orElse(null);
    }

    private <T> Stored<T> merge(Stored<T> old, T data, LocalDateTime now) {
        return old == null
                ? new Stored<>(UUID.randomUUID(), data, now, now)
                : new Stored<>(old.id(), data, old.createdAt(), now);
    }

    private void requireTeam(UUID teamId) {
        boolean known = teams.values().stream().anyMatch(t -> t.id().equals(teamId));
        if (!known) throw new ReferenceException("Équipe inconnue : " + teamId);
    }

    private void requireMatch(UUID matchId) {
        if (matchById(matchId) == null) throw new ReferenceException("Match inconnu : " + matchId);
    }
}

package com.tony.esportsAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.mapper.ProviderPayloadMapper;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.*;
import com.tony.esportsAnalytics.repository.CanonicalStore;
import com.tony.esportsAnalytics.repository.MatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ingestion d'un match brut : équipes, tournoi, match, puis prédiction et cotes embarquées.
 * Tout est écrit dans UNE transaction : au moindre échec, rien n'est conservé pour ce match.
 * Rejouer le même payload ne crée aucune ligne, seuls {@code last_fetched_at} et
 * {@code updated_at} avancent.
 */
@Service
@Slf4j
public class MatchIngestionService {

    private final Map<String, ProviderPayloadMapper> mappers;
    private final EntityResolverService entityResolver;
    private final CanonicalStore store;
    private final MatchRepository matchRepository;
    private final Clock clock;

    public MatchIngestionService(List<ProviderPayloadMapper> mappers,
                                 EntityResolverService entityResolver,
                                 CanonicalStore store,
                                 MatchRepository matchRepository,
                                 Clock clock) {
        this.mappers = mappers.stream()
                .collect(Collectors.toMap(ProviderPayloadMapper::sourceType, Function.identity()));
        this.entityResolver = entityResolver;
        this.store = store;
        this.matchRepository = matchRepository;
        this.clock = clock;
    }

    public Set<String> supportedSourceTypes() {
        return Collections.unmodifiableSet(mappers.keySet());
    }

    @Transactional
    public UUID ingestMatch(JsonNode rawMatchPayload, String sourceType) {
        String source = EntityResolverService.normalizeSourceType(sourceType);
        ProviderPayloadMapper mapper = mappers.get(source);
        if (mapper == null) {
            throw new ValidationException("Source non prise en charge : " + source);
        }

        MatchData data = mapper.toMatch(rawMatchPayload);
        if (data.getTeam1().getSourceId().equals(data.getTeam2().getSourceId())) {
            throw new ValidationException("Un match doit opposer deux équipes distinctes (équipe " + data.getTeam1().getSourceId() + ")");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. Références
        UUID team1Id = entityResolver.resolveTeam(source, data.getTeam1());
        UUID team2Id = entityResolver.resolveTeam(source, data.getTeam2());
        UUID tournamentId = data.getTournament() != null
                ? entityResolver.resolveTournament(source, data.getTournament())
                : null;

        // 2. Match
        MatchRow.MatchRowBuilder row = MatchRow.builder()
                .sourceType(source)
                .sourceId(data.getSourceId())
                .slug(data.getSlug())
                .team1Id(team1Id)
                .team2Id(team2Id)
                .tournamentId(tournamentId)
                .status(data.getStatus())
                .startDate(data.getStartDate())
                .boType(data.getBoType())
                .tier(data.getTier())
                .rawPayload(rawMatchPayload)
                .fetchedAt(now);
        applyResult(row, data, team1Id, team2Id);
        UUID matchId = store.upsertMatch(row.build());

        // 3. Données dépendantes, après la ligne du match
        if (data.getPrediction() != null) {
            writePrediction(matchId, source, data.getPrediction(), now);
        }
        for (OddsData odds : data.getOdds()) {
            writeOddsQuote(matchId, source, alignSides(odds, data), now);
        }

        log.info("✅ Match {}/{} ingéré ({} vs {}, {}) -> {}", source, data.getSourceId(),
                data.getTeam1().getName(), data.getTeam2().getName(), data.getStatus(), matchId);
        return matchId;
    }

    /**
     * Enregistre ou remplace la prédiction de {@code sourceType} pour un match existant.
     */
    @Transactional
    public UUID ingestPrediction(UUID matchId, String sourceType, PredictionData prediction) {
        requireMatch(matchId);
        return writePrediction(matchId, EntityResolverService.normalizeSourceType(sourceType), prediction,
                LocalDateTime.now(clock));
    }

    /**
     * Enregistre ou remplace la cote d'un bookmaker pour un match existant. Les côtés doivent
     * déjà suivre l'ordre team1/team2 du match.
     */
    @Transactional
    public UUID ingestOddsQuote(UUID matchId, String sourceType, OddsData odds) {
        requireMatch(matchId);
        return writeOddsQuote(matchId, EntityResolverService.normalizeSourceType(sourceType), odds,
                LocalDateTime.now(clock));
    }

    // --- Résultat ---

    private void applyResult(MatchRow.MatchRowBuilder row, MatchData data, UUID team1Id, UUID team2Id) {
        if (data.getStatus() != MatchStatus.FINISHED) {
            // Score partiel d'un match en cours : non conservé en colonnes, il reste dans raw_payload
            return;
        }

        Integer s1 = data.getTeam1Score();
        Integer s2 = data.getTeam2Score();
        if (s1 == null || s2 == null) {
            throw new ValidationException("Match terminé sans score : " + data.getSourceId());
        }
        if (s1 < 0 || s2 < 0) {
            throw new ValidationException(String.format("Score négatif pour le match %d : %d-%d", data.getSourceId(), s1, s2));
        }
        if (s1.equals(s2)) {
            throw new ValidationException(String.format("Match terminé sur une égalité %d-%d : %d", s1, s2, data.getSourceId()));
        }

        boolean team1Wins = s1 > s2;
        row.team1Score(s1)
                .team2Score(s2)
                .winnerTeamId(team1Wins ? team1Id : team2Id)
                .loserTeamId(team1Wins ? team2Id : team1Id);

        Long declared = data.getDeclaredWinnerSourceId();
        Long derived = team1Wins ? data.getTeam1().getSourceId() : data.getTeam2().getSourceId();
        if (declared != null && !declared.equals(derived)) {
            log.warn("Match {} : vainqueur annoncé {} incohérent avec le score {}-{}, on garde le score",
                    data.getSourceId(), declared, s1, s2);
        }
    }

    // Le bloc de cotes peut lister les équipes dans l'autre sens que le match
    private OddsData alignSides(OddsData odds, MatchData data) {
        Long team1 = data.getTeam1().getSourceId();
        Long team2 = data.getTeam2().getSourceId();
        boolean reversed = team2.equals(odds.getTeam1ProviderTeamId()) || team1.equals(odds.getTeam2ProviderTeamId());
        return reversed ? odds.swapSides() : odds;
    }

    // --- Écritures ---

    private UUID writePrediction(UUID matchId, String source, PredictionData prediction, LocalDateTime now) {
        if (prediction == null || prediction.getPayload() == null || prediction.getPayload().isNull()) {
            throw new ValidationException("Prédiction vide pour le match " + matchId);
        }
        return store.upsertPrediction(matchId, source, prediction, now);
    }

    private UUID writeOddsQuote(UUID matchId, String source, OddsData odds, LocalDateTime now) {
        if (odds == null || odds.getProvider() == null || odds.getProvider().isBlank()) {
            throw new ValidationException("Cote sans bookmaker pour le match " + matchId);
        }
        Double implied1 = OddsMath.impliedProbability(odds.getTeam1Odds());
        Double implied2 = OddsMath.impliedProbability(odds.getTeam2Odds());
        return store.upsertOddsQuote(matchId, source, odds, implied1, implied2, now);
    }

    private void requireMatch(UUID matchId) {
        if (matchId == null || !matchRepository.existsById(matchId)) {
            throw new ResourceNotFoundException("Match", matchId);
        }
    }
}

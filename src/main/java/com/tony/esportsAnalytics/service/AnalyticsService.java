package com.tony.esportsAnalytics.service;

import com.tony.esportsAnalytics.config.AnalyticsProperties;
import com.tony.esportsAnalytics.exception.ResourceNotFoundException;
import com.tony.esportsAnalytics.model.*;
import com.tony.esportsAnalytics.model.dto.ComparisonResult;
import com.tony.esportsAnalytics.model.dto.ValueBetCandidate;
import com.tony.esportsAnalytics.repository.MatchRepository;
import com.tony.esportsAnalytics.repository.OddsQuoteRepository;
import com.tony.esportsAnalytics.repository.PredictionRepository;
import com.tony.esportsAnalytics.repository.TeamRepository;
import com.tony.esportsAnalytics.service.PredictionPayloadReader.PredictedScore;
import com.tony.esportsAnalytics.service.PredictionPayloadReader.WinProbabilities;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Lecture seule : confronte les prédictions au résultat réel et cherche les value bets
 * dans les cotes stockées.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class AnalyticsService {

    private final MatchRepository matchRepository;
    private final PredictionRepository predictionRepository;
    private final OddsQuoteRepository oddsQuoteRepository;
    private final TeamRepository teamRepository;
    private final AnalyticsProperties properties;

    public ComparisonResult compareOutcome(UUID matchId) {
        Match match = findMatch(matchId);
        return evaluate(match, predictionRepository.findByMatchIdOrderByCreatedAtAsc(matchId));
    }

    /**
     * Compare la prédiction retenue au résultat d'un match déjà chargé.
     * Utilisé aussi par le tableau de bord, qui charge les matchs en masse.
     */
    public ComparisonResult evaluate(Match match, List<Prediction> predictions) {
        UUID matchId = match.getId();
        if (!match.isFinished()) {
            return ComparisonResult.notApplicable(matchId, "Match non terminé (" + match.getStatus() + ")");
        }
        if (predictions.isEmpty()) {
            return ComparisonResult.notApplicable(matchId, "Aucune prédiction pour ce match");
        }
        if (match.getWinner() == null) {
            return ComparisonResult.notApplicable(matchId, "Résultat incomplet");
        }

        Prediction prediction = choosePrediction(match, predictions);
        Optional<Long> predictedSourceId = PredictionPayloadReader.predictedWinnerSourceId(prediction.getPredictionPayload());
        if (predictedSourceId.isEmpty()) {
            return ComparisonResult.notApplicable(matchId, "Prédiction sans vainqueur");
        }

        // L'id prédit est local à la source de la prédiction
        Optional<Team> predictedWinner = teamRepository.findBySourceTypeAndSourceId(prediction.getSourceType(), predictedSourceId.get());
        if (predictedWinner.isEmpty()) {
            log.warn("Match {} : vainqueur prédit {}/{} inconnu", matchId, prediction.getSourceType(), predictedSourceId.get());
            return ComparisonResult.notApplicable(matchId, "Équipe prédite inconnue : " + predictedSourceId.get());
        }

        UUID predictedId = predictedWinner.get().getId();
        UUID actualId = match.getWinner().getId();
        Optional<PredictedScore> predictedScore = PredictionPayloadReader.predictedScore(prediction.getPredictionPayload());

        return ComparisonResult.builder()
                .matchId(matchId)
                .applicable(true)
                .predictionSourceType(prediction.getSourceType())
                .predictedWinnerTeamId(predictedId)
                .actualWinnerTeamId(actualId)
                .correct(predictedId.equals(actualId))
                .confidence(PredictionPayloadReader.confidence(prediction.getPredictionPayload()).orElse(null))
                .predictedScore(predictedScore.map(PredictedScore::toString).orElse(null))
                .actualScore(match.getTeam1Score() + "-" + match.getTeam2Score())
                .exactScoreCorrect(predictedScore
                        .map(s -> s.team1() == match.getTeam1Score() && s.team2() == match.getTeam2Score())
                        .orElse(null))
                .build();
    }

    public List<ValueBetCandidate> evaluateValueBets(UUID matchId) {
        return evaluateValueBets(matchId, properties.getDefaultMinExpectedValue());
    }

    /**
     * Value bets d'un match, triés par EV décroissante. Seuls les côtés dont l'EV dépasse
     * strictement {@code minExpectedValue} sont gardés. Liste vide sans cotes ou sans
     * probabilités estimées.
     */
    public List<ValueBetCandidate> evaluateValueBets(UUID matchId, double minExpectedValue) {
        Match match = findMatch(matchId);

        List<OddsQuote> quotes = oddsQuoteRepository.findByMatchIdOrderByProviderAsc(matchId);
        if (quotes.isEmpty()) return List.of();

        Optional<WinProbabilities> estimate = estimatedProbabilities(match, predictionRepository.findByMatchIdOrderByCreatedAtAsc(matchId));
        if (estimate.isEmpty()) {
            log.debug("Match {} : aucune probabilité estimée, pas de value bet", matchId);
            return List.of();
        }

        List<ValueBetCandidate> candidates = new ArrayList<>();
        for (OddsQuote quote : quotes) {
            candidate(match, quote, BetSide.TEAM1, quote.getTeam1Odds(), estimate.get().team1()).ifPresent(candidates::add);
            candidate(match, quote, BetSide.TEAM2, quote.getTeam2Odds(), estimate.get().team2()).ifPresent(candidates::add);
        }

        return candidates.stream()
                .filter(c -> c.getExpectedValue() > minExpectedValue)
                .sorted(Comparator.comparingDouble(ValueBetCandidate::getExpectedValue).reversed())
                .toList();
    }

    private Optional<ValueBetCandidate> candidate(Match match, OddsQuote quote, BetSide side, Double odds, double probability) {
        if (!OddsMath.isValidOdds(odds)) return Optional.empty();

        Team team = side == BetSide.TEAM1 ? match.getTeam1() : match.getTeam2();
        return Optional.of(ValueBetCandidate.builder()
                .matchId(match.getId())
                .side(side)
                .teamId(team != null ? team.getId() : null)
                .teamName(team != null ? team.getName() : null)
                .oddsSourceType(quote.getSourceType())
                .provider(quote.getProvider())
                .decimalOdds(odds)
                .impliedProbability(OddsMath.impliedProbability(odds))
                .estimatedProbability(probability)
                .expectedValue(OddsMath.expectedValue(probability, odds))
                .kellyFraction(OddsMath.kellyFraction(probability, odds))
                .build());
    }

    // La prédiction retenue d'abord, puis les autres par ancienneté
    private Optional<WinProbabilities> estimatedProbabilities(Match match, List<Prediction> predictions) {
        if (predictions.isEmpty()) return Optional.empty();
        Prediction preferred = choosePrediction(match, predictions);

        List<Prediction> ordered = new ArrayList<>();
        ordered.add(preferred);
        predictions.stream().filter(p -> p != preferred).forEach(ordered::add);

        return ordered.stream()
                .map(p -> PredictionPayloadReader.winProbabilities(p.getPredictionPayload()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * La prédiction de la même source que le match si elle existe, sinon la plus ancienne.
     */
    Prediction choosePrediction(Match match, List<Prediction> predictions) {
        return predictions.stream()
                .filter(p -> Objects.equals(p.getSourceType(), match.getSourceType()))
                .findFirst()
                .orElseGet(() -> predictions.stream()
                        .min(Comparator.comparing(Prediction::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                        .orElseThrow());
    }

    private Match findMatch(UUID matchId) {
        return matchRepository.findWithTeamsById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));
    }
}

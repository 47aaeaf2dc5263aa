package com.tony.esportsAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Lecture des champs utiles d'un payload de prédiction :
 * <pre>
 * { prediction_winner_team_id, prediction_team1_score, prediction_team2_score,
 *   team1_win_probability, team2_win_probability,
 *   prediction_scores_data: { overall_proximity_factor, ... } }
 * </pre>
 * Tous les champs sont optionnels, un champ absent ou illisible donne un Optional vide.
 * <p>
 * Les payloads BO3 n'ont pas de {@code team*_win_probability} : ces champs viennent d'un modèle externe,
 * dont la prédiction est enregistrée sous sa propre source via {@code MatchIngestionService.ingestPrediction}.
 */
public final class PredictionPayloadReader {

    private PredictionPayloadReader() {
    }

    public record WinProbabilities(double team1, double team2) {}

    public record PredictedScore(int team1, int team2) {
        @Override
        public String toString() {
            return team1 + "-" + team2;
        }
    }

    /** Vainqueur prédit, en identifiant d'équipe local au fournisseur. */
    public static Optional<Long> predictedWinnerSourceId(JsonNode payload) {
        JsonNode value = field(payload, "prediction_winner_team_id");
        if (value == null) return Optional.empty();
        if (value.canConvertToLong()) return Optional.of(value.asLong());
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.matches("\\d+")) return Optional.of(Long.parseLong(text));
        }
        return Optional.empty();
    }

    public static Optional<PredictedScore> predictedScore(JsonNode payload) {
        JsonNode s1 = field(payload, "prediction_team1_score");
        JsonNode s2 = field(payload, "prediction_team2_score");
        if (s1 == null || s2 == null || !s1.isNumber() || !s2.isNumber()) return Optional.empty();
        return Optional.of(new PredictedScore(s1.asInt(), s2.asInt()));
    }

    /** Indice de confiance du modèle : prediction_scores_data.overall_proximity_factor. */
    public static Optional<Double> confidence(JsonNode payload) {
        JsonNode scores = field(payload, "prediction_scores_data");
        JsonNode value = scores != null ? field(scores, "overall_proximity_factor") : null;
        if (value == null || !value.isNumber()) return Optional.empty();
        return Optional.of(value.asDouble());
    }

    /**
     * Probabilités de victoire estimées. Acceptées en [0, 1] ou en pourcentage ]1, 100].
     * Si un seul côté est donné, l'autre vaut 1 - p. Rien si aucun côté n'est exploitable.
     */
    public static Optional<WinProbabilities> winProbabilities(JsonNode payload) {
        Double p1 = probability(field(payload, "team1_win_probability"));
        Double p2 = probability(field(payload, "team2_win_probability"));

        if (p1 == null && p2 == null) return Optional.empty();
        if (p1 == null) p1 = 1.0 - p2;
        if (p2 == null) p2 = 1.0 - p1;
        return Optional.of(new WinProbabilities(p1, p2));
    }

    private static Double probability(JsonNode value) {
        if (value == null || !value.isNumber()) return null;
        double p = value.asDouble();
        if (p > 1.0 && p <= 100.0) p = p / 100.0;
        return p >= 0.0 && p <= 1.0 ? p : null;
    }

    private static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) return null;
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }
}

package com.tony.esportsAnalytics.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.model.MatchStatus;
import com.tony.esportsAnalytics.model.dto.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Payloads de l'API BO3.gg (CS2).
 * <pre>
 * { id, slug, status, start_date, bo_type, tier, team1_score, team2_score, winner_team_id,
 *   team1: {id, name, slug, country_code, logo_url}, team2: {...},
 *   tournament: {id, name, slug, tier, tier_rank, prize, discipline_id, status, start_date, end_date},
 *   ai_predictions: {id, prediction_winner_team_id, prediction_scores_data: {...}},
 *   bet_updates: [{provider, team_1: {coeff, team_id}, team_2: {...}}] }
 * </pre>
 * Les dates BO3 sont en UTC, stockées sans fuseau.
 */
@Component
@Slf4j
public class Bo3PayloadMapper implements ProviderPayloadMapper {

    public static final String SOURCE_TYPE = "bo3";

    @Override
    public String sourceType() {
        return SOURCE_TYPE;
    }

    @Override
    public String displayName() {
        return "BO3.gg";
    }

    @Override
    public MatchData toMatch(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("Le payload de match doit être un objet JSON");
        }

        Long matchId = requiredId(payload, "id", "match");

        return MatchData.builder()
                .sourceId(matchId)
                .slug(text(payload, "slug"))
                .status(MatchStatus.fromProvider(text(payload, "status")))
                .startDate(dateTime(payload, "start_date"))
                .boType(integer(payload, "bo_type"))
                .tier(text(payload, "tier"))
                .team1Score(integer(payload, "team1_score"))
                .team2Score(integer(payload, "team2_score"))
                .declaredWinnerSourceId(longValue(payload, "winner_team_id"))
                .team1(team(payload.get("team1"), "team1"))
                .team2(team(payload.get("team2"), "team2"))
                .tournament(tournament(payload.get("tournament")))
                .prediction(prediction(payload.get("ai_predictions")))
                .odds(odds(payload.get("bet_updates")))
                .rawPayload(payload)
                .build();
    }

    private TeamData team(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Équipe manquante : " + field);
        }
        String name = text(node, "name");
        if (name == null) {
            throw new ValidationException("Nom d'équipe manquant : " + field);
        }
        return TeamData.builder()
                .sourceId(requiredId(node, "id", field))
                .name(name)
                .slug(text(node, "slug"))
                .countryCode(text(node, "country_code"))
                .logoUrl(text(node, "logo_url"))
                .metadata(node)
                .build();
    }

    // Un match sans tournoi est accepté, un tournoi incomplet non
    private TournamentData tournament(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) {
            throw new ValidationException("Le bloc tournament doit être un objet");
        }
        String name = text(node, "name");
        if (name == null) {
            throw new ValidationException("Nom de tournoi manquant");
        }
        return TournamentData.builder()
                .sourceId(requiredId(node, "id", "tournament"))
                .name(name)
                .slug(text(node, "slug"))
                .tier(text(node, "tier"))
                .tierRank(integer(node, "tier_rank"))
                .prizePool(longValue(node, "prize"))
                .disciplineId(integer(node, "discipline_id"))
                .status(text(node, "status"))
                .startDate(dateTime(node, "start_date"))
                .endDate(dateTime(node, "end_date"))
                .metadata(node)
                .build();
    }

    private PredictionData prediction(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) {
            throw new ValidationException("Le bloc ai_predictions doit être un objet");
        }
        return PredictionData.builder()
                .sourceId(requiredId(node, "id", "ai_predictions"))
                .payload(node)
                .build();
    }

    // bet_updates arrive tantôt en tableau, tantôt en objet unique
    private List<OddsData> odds(JsonNode node) {
        List<OddsData> result = new ArrayList<>();
        if (node == null || node.isNull()) return result;

        if (node.isArray()) {
            for (JsonNode item : node) {
                result.add(oddsQuote(item));
            }
        } else {
            result.add(oddsQuote(node));
        }
        return result;
    }

    private OddsData oddsQuote(JsonNode node) {
        String provider = text(node, "provider");
        if (provider == null) {
            throw new ValidationException("Fournisseur de cotes manquant dans bet_updates");
        }
        JsonNode side1 = node.get("team_1");
        JsonNode side2 = node.get("team_2");
        if (side1 == null || !side1.isObject() || side2 == null || !side2.isObject()) {
            throw new ValidationException("Cotes incomplètes pour le bookmaker " + provider);
        }
        return OddsData.builder()
                .provider(provider)
                .team1Odds(decimal(side1, "coeff"))
                .team2Odds(decimal(side2, "coeff"))
                .team1ProviderTeamId(longValue(side1, "team_id"))
                .team2ProviderTeamId(longValue(side2, "team_id"))
                .payload(node)
                .build();
    }

    // --- Lecture des champs ---

    private Long requiredId(JsonNode node, String field, String context) {
        Long id = longValue(node, field);
        if (id == null || id <= 0) {
            throw new ValidationException(String.format("Identifiant '%s' manquant ou invalide (%s)", field, context));
        }
        return id;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private Integer integer(JsonNode node, String field) {
        Long value = longValue(node, field);
        if (value == null) return null;
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ValidationException(String.format("Champ '%s' hors limites : %d", field, value));
        }
        return value.intValue();
    }

    private Long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw new ValidationException(String.format("Champ '%s' hors limites : %s", field, value));
            }
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(String.format("Champ '%s' non numérique : %s", field, value.asText()));
            }
        }
        throw new ValidationException(String.format("Champ '%s' non numérique : %s", field, value));
    }

    private Double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.asDouble();
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            log.warn("Cote illisible '{}' pour le champ {}, ignorée", value.asText(), field);
            return null;
        }
    }

    private LocalDateTime dateTime(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null) return null;
        try {
            if (raw.length() == 10) return LocalDate.parse(raw).atStartOfDay();

            // Avec ou sans fuseau : "2025-03-14T18:00:00Z", "2025-03-14T18:00:00"
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            log.warn("Date illisible '{}' pour le champ {}, ignorée", raw, field);
            return null;
        }
    }
}

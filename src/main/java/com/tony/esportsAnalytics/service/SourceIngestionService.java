package com.tony.esportsAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.exception.EsportsDataException;
import com.tony.esportsAnalytics.exception.ValidationException;
import com.tony.esportsAnalytics.model.DataSource;
import com.tony.esportsAnalytics.model.dto.IngestionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Point d'entrée des collecteurs : vérifie que la source est active puis ingère match par match.
 * Chaque match passe par le proxy transactionnel de {@link MatchIngestionService} et
 * a donc sa propre transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceIngestionService {

    private final MatchIngestionService matchIngestionService;

    public UUID ingest(DataSource source, JsonNode payload) {
        requireActive(source);
        return matchIngestionService.ingestMatch(payload, source.getName());
    }

    /**
     * Un payload invalide est consigné dans le rapport sans interrompre le lot.
     * Une panne du stockage ({@code DataAccessException}) interrompt tout le lot.
     */
    public IngestionReport ingestBatch(DataSource source, List<JsonNode> payloads) {
        requireActive(source);
        IngestionReport report = new IngestionReport(source.getName());
        report.setReceived(payloads.size());

        for (int i = 0; i < payloads.size(); i++) {
            JsonNode payload = payloads.get(i);
            try {
                report.recordSuccess(matchIngestionService.ingestMatch(payload, source.getName()));
            } catch (EsportsDataException e) {
                log.warn("⚠️ Match #{} du lot {} rejeté : {}", i, source.getName(), e.getMessage());
                report.recordFailure(i, providerMatchId(payload), e.getMessage());
            }
        }

        log.info("Lot {} terminé : {}/{} matchs ingérés", source.getName(),
                report.getIngestedMatchIds().size(), report.getReceived());
        return report;
    }

    private void requireActive(DataSource source) {
        if (source == null) {
            throw new ValidationException("Source de données requise");
        }
        if (!source.isActive()) {
            throw new ValidationException("Source désactivée : " + source.getName());
        }
    }

    private String providerMatchId(JsonNode payload) {
        JsonNode id = payload != null ? payload.get("id") : null;
        return id != null && !id.isNull() ? id.asText() : null;
    }
}

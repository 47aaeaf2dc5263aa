package com.tony.esportsAnalytics.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.esportsAnalytics.model.DataSource;
import com.tony.esportsAnalytics.model.dto.IngestionReport;
import com.tony.esportsAnalytics.service.DataSourceService;
import com.tony.esportsAnalytics.service.SourceIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Réception des payloads déjà récupérés par les collecteurs externes.
 * Un objet = un match, un tableau = un lot avec rapport.
 */
@RestController
@RequestMapping("/api/v1/ingestion")
@RequiredArgsConstructor
public class IngestionController {
    private final DataSourceService dataSourceService;
    private final SourceIngestionService sourceIngestionService;

    @PostMapping("/{sourceType}/matches")
    public ResponseEntity<?> ingestMatches(@PathVariable String sourceType, @RequestBody JsonNode body) {
        DataSource source = dataSourceService.resolveForIngestion(sourceType);

        if (body.isArray()) {
            List<JsonNode> payloads = new ArrayList<>();
            body.forEach(payloads::add);
            IngestionReport report = sourceIngestionService.ingestBatch(source, payloads);
            return ResponseEntity.ok(report);
        }

        UUID matchId = sourceIngestionService.ingest(source, body);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("matchId", matchId));
    }
}
